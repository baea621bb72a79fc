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

import io.classicrouter.proxy.protocol.Eof;
import io.classicrouter.proxy.protocol.Row;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.protocol.Value;
import io.classicrouter.proxy.service.QueryHandler;

/**
 * Checks that a statement returns a single row with a single column which is {@code 1}.
 * <p>
 * A resultset of another shape fails with an error naming what is wrong with it. A value other
 * than {@code 1} fails with the error the caller passed in.
 * </p>
 */
class IsTrueHandler implements QueryHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(IsTrueHandler.class);

    static final ServerError TOO_MANY_COLUMNS = ServerError.general("Too many columns");
    static final ServerError NO_FIELDS = ServerError.general("No fields");
    static final ServerError NULL_VALUE = ServerError.general("Expected integer, got NULL");
    static final ServerError NO_ROWS = ServerError.general("No rows");
    static final ServerError TOO_MANY_ROWS = ServerError.general("Too many rows");

    private final Consumer<ServerError> onFailure;
    private final ServerError onConditionFail;

    private long rowCount;

    IsTrueHandler(Consumer<ServerError> onFailure, ServerError onConditionFail) {
        this.onFailure = Objects.requireNonNull(onFailure);
        this.onConditionFail = Objects.requireNonNull(onConditionFail);
    }

    @Override
    public void onColumnCount(long count) {
        if (count != 1) {
            onFailure.accept(TOO_MANY_COLUMNS);
        }
    }

    @Override
    public void onRow(Row row) {
        ++rowCount;

        if (row.isEmpty()) {
            onFailure.accept(NO_FIELDS);
            return;
        }

        Value field = row.get(0);
        if (field.isNull()) {
            onFailure.accept(NULL_VALUE);
            return;
        }

        if (!"1".equals(field.value())) {
            onFailure.accept(onConditionFail);
        }
    }

    @Override
    public void onRowEnd(Eof eof) {
        if (rowCount == 0) {
            onFailure.accept(NO_ROWS);
        }
        else if (rowCount > 1) {
            onFailure.accept(TOO_MANY_ROWS);
        }
    }

    @Override
    public void onError(ServerError error) {
        LOGGER.warn("{}", error.message());

        onFailure.accept(error);
    }
}
