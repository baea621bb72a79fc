/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.service;

import io.classicrouter.proxy.protocol.ColumnMeta;
import io.classicrouter.proxy.protocol.Eof;
import io.classicrouter.proxy.protocol.OkMessage;
import io.classicrouter.proxy.protocol.Row;
import io.classicrouter.proxy.protocol.ServerError;

/**
 * Receives the response of a COM_QUERY.
 *
 * <p>A response is either a single {@link #onOk}, a single {@link #onError}, or a resultset:
 * {@link #onColumnCount}, one {@link #onColumn} per column, any number of {@link #onRow} and a
 * closing {@link #onRowEnd}.</p>
 */
public interface QueryHandler {

    default void onColumnCount(long count) {
    }

    default void onColumn(ColumnMeta column) {
    }

    default void onRow(Row row) {
    }

    default void onRowEnd(Eof eof) {
    }

    default void onOk(OkMessage ok) {
    }

    default void onError(ServerError error) {
    }
}
