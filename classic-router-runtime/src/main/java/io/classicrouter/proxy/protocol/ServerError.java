/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

import java.util.Objects;

/**
 * Error message as sent by the server, or as generated by the router on behalf of the server.
 *
 * @param code error code, 0 if the error has no specific code
 * @param message human readable message
 * @param sqlState 5 character SQL state
 */
public record ServerError(int code, String message, String sqlState) {

    public static final String GENERAL_SQL_STATE = "HY000";

    public ServerError {
        Objects.requireNonNull(message, "message cannot be null");
        Objects.requireNonNull(sqlState, "sqlState cannot be null");
    }

    /**
     * Error with code 0 and the general SQL state {@value #GENERAL_SQL_STATE}.
     */
    public static ServerError general(String message) {
        return new ServerError(0, message, GENERAL_SQL_STATE);
    }
}
