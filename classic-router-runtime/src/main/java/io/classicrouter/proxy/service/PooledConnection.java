/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.service;

import java.util.Objects;

import io.classicrouter.proxy.protocol.ServerMode;
import io.classicrouter.proxy.protocol.ServerSideProtocolState;

/**
 * An authenticated server connection while it is owned by the {@link ConnectionPool}.
 *
 * @param channel the connection
 * @param protocol its protocol state, including the identity it is authenticated as
 * @param mode the role of the server it is connected to
 */
public record PooledConnection(
                               ServerChannel channel,
                               ServerSideProtocolState protocol,
                               ServerMode mode) {

    public PooledConnection {
        Objects.requireNonNull(channel);
        Objects.requireNonNull(protocol);
        Objects.requireNonNull(mode);
    }
}
