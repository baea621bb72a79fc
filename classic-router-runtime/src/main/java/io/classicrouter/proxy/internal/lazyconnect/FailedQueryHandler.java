/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.lazyconnect;

import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.service.QueryHandler;

/**
 * Fails on an error response to the statement, ignores everything else.
 */
class FailedQueryHandler implements QueryHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(FailedQueryHandler.class);

    private final Consumer<ServerError> onFailure;
    private final String statement;

    FailedQueryHandler(Consumer<ServerError> onFailure, String statement) {
        this.onFailure = Objects.requireNonNull(onFailure);
        this.statement = Objects.requireNonNull(statement);
    }

    @Override
    public void onError(ServerError error) {
        LOGGER.warn("Executing {} failed: {}", statement, error.message());

        onFailure.accept(error);
    }
}
