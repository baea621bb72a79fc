/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.service;

import java.util.Optional;

import io.classicrouter.proxy.protocol.ServerMode;

/**
 * Pool of idle, authenticated server connections that can be shared between client connections.
 */
public interface ConnectionPool {

    /**
     * Takes an idle connection out of the pool.
     *
     * @param mode the role the server must serve
     * @return an authenticated connection, or empty if none is available
     */
    Optional<PooledConnection> pop(ServerMode mode);

    /**
     * Hands a server connection to the pool.
     *
     * @param connection connection that is idle
     * @return true if the pool took it, false if the pool is full and the caller still owns it
     */
    boolean add(PooledConnection connection);
}
