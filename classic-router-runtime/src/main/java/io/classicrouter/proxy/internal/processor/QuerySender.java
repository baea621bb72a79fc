/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.processor;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.classicrouter.proxy.internal.ClassicConnection;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.service.QueryHandler;
import io.classicrouter.proxy.service.ServerChannel;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Sends a statement to the server and streams the response into a {@link QueryHandler}.
 * <p>
 * A connection that breaks while the statement is in flight is reported to the handler as an
 * error.
 * </p>
 */
public class QuerySender extends ServerCommandProcessor<Void> {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuerySender.class);

    private final String statement;
    private final QueryHandler handler;

    public QuerySender(ClassicConnection connection, String statement, QueryHandler handler) {
        super(connection);
        this.statement = Objects.requireNonNull(statement);
        this.handler = Objects.requireNonNull(handler);
    }

    public String statement() {
        return statement;
    }

    @Override
    protected CompletionStage<Void> send(ServerChannel channel) {
        LOGGER.trace("{}: query: {}", connection().connectionId(), statement);
        return channel.query(statement, handler);
    }

    @Override
    protected void onSuccess(@Nullable Void response) {
        // the handler saw the response already
    }

    @Override
    protected void onFailure(ServerError error) {
        handler.onError(error);
    }
}
