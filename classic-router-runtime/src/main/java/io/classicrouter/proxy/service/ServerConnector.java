/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.service;

import java.util.concurrent.CompletionStage;

import io.classicrouter.proxy.protocol.ServerMode;

/**
 * Opens fresh connections to a server of the routing destination.
 */
@FunctionalInterface
public interface ServerConnector {

    /**
     * Connects to a server that serves the given role.
     *
     * @param mode the role the client expects
     * @return stage completing with the connected, but not yet greeted, channel
     */
    CompletionStage<ServerChannel> connect(ServerMode mode);
}
