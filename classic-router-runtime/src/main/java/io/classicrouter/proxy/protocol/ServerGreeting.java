/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

import java.util.Set;

/**
 * Initial handshake message of the server.
 *
 * @param protocolVersion protocol version, 10 for all supported servers
 * @param serverVersion version string of the server
 * @param connectionId server's id of this connection
 * @param capabilities capabilities announced by the server
 * @param statusFlags server status flags
 */
public record ServerGreeting(
                             int protocolVersion,
                             String serverVersion,
                             long connectionId,
                             Set<Capability> capabilities,
                             int statusFlags) {

    public ServerGreeting {
        capabilities = Set.copyOf(capabilities);
    }
}
