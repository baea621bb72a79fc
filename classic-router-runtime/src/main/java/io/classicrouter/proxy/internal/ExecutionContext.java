/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal;

/**
 * Session state of a client connection that has to follow the client from server connection to
 * server connection.
 */
public class ExecutionContext {

    private final SystemVariables systemVariables = new SystemVariables();

    public SystemVariables systemVariables() {
        return systemVariables;
    }
}
