/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.lazyconnect;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.classicrouter.proxy.internal.ClassicConnection;
import io.classicrouter.proxy.internal.SystemVariables;
import io.classicrouter.proxy.protocol.Eof;
import io.classicrouter.proxy.protocol.OkMessage;
import io.classicrouter.proxy.protocol.Row;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.protocol.Value;
import io.classicrouter.proxy.service.QueryHandler;

/**
 * Captures session variables into the connection's {@link SystemVariables}.
 * <p>
 * Expects a resultset of two columns, the variable's name and its value, with one row per
 * variable. The column names are ignored. The captured variables are only stored once the
 * whole resultset was read.
 * </p>
 * <p>
 * Anything unexpected doesn't fail the statement. The connection just can't be shared anymore
 * as its session state isn't fully known.
 * </p>
 */
class SelectSessionVariablesHandler implements QueryHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(SelectSessionVariablesHandler.class);

    private final ClassicConnection connection;
    private final List<Map.Entry<String, Value>> sessionVariables = new ArrayList<>();

    private boolean somethingFailed;

    SelectSessionVariablesHandler(ClassicConnection connection) {
        this.connection = Objects.requireNonNull(connection);
    }

    @Override
    public void onColumnCount(long count) {
        if (count != 2) {
            somethingFailed = true;
        }
    }

    @Override
    public void onRow(Row row) {
        if (somethingFailed) {
            return;
        }

        if (row.size() < 2 || row.get(0).isNull()) {
            somethingFailed = true;
            return;
        }

        sessionVariables.add(Map.entry(Objects.requireNonNull(row.get(0).value()), row.get(1)));
    }

    @Override
    public void onRowEnd(Eof eof) {
        if (somethingFailed) {
            connection.someStateChanged(true);
            return;
        }

        SystemVariables systemVariables = connection.executionContext().systemVariables();
        for (Map.Entry<String, Value> variable : sessionVariables) {
            systemVariables.set(variable.getKey(), variable.getValue());
        }
        sessionVariables.clear();
    }

    @Override
    public void onOk(OkMessage ok) {
        connection.someStateChanged(true);
    }

    @Override
    public void onError(ServerError error) {
        LOGGER.debug("{}: fetching system-vars failed: {}", connection.connectionId(), error.message());

        connection.someStateChanged(true);
    }
}
