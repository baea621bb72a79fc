/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

/**
 * Fails a pending server command with the error message the server replied with.
 */
public class ServerErrorException extends Exception {

    private final transient ServerError error;

    public ServerErrorException(ServerError error) {
        super(error.code() + " (" + error.sqlState() + "): " + error.message());
        this.error = error;
    }

    public ServerError error() {
        return error;
    }
}
