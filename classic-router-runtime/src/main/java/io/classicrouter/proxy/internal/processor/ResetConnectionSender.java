/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.processor;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.classicrouter.proxy.internal.ClassicConnection;
import io.classicrouter.proxy.internal.tracing.TraceSpan;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.service.ServerChannel;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Resets the session of a server connection that is already authenticated as the right user.
 * <p>
 * On failure the server connection is closed and the connection is no longer authenticated.
 * </p>
 */
public class ResetConnectionSender extends ServerCommandProcessor<Void> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResetConnectionSender.class);

    private final Consumer<ServerError> onError;
    private final @Nullable TraceSpan parentSpan;
    private @Nullable TraceSpan span;

    public ResetConnectionSender(ClassicConnection connection, Consumer<ServerError> onError, @Nullable TraceSpan parentSpan) {
        super(connection);
        this.onError = Objects.requireNonNull(onError);
        this.parentSpan = parentSpan;
    }

    @Override
    protected CompletionStage<Void> send(ServerChannel channel) {
        span = TraceSpan.start(connection().context().tracer(), "mysql/reset_connection", parentSpan);
        return channel.resetConnection();
    }

    @Override
    protected void onSuccess(@Nullable Void response) {
        if (span != null) {
            span.end();
        }
    }

    @Override
    protected void onFailure(ServerError error) {
        LOGGER.debug("{}: reset-connection failed: {}", connection().connectionId(), error.message());
        if (span != null) {
            span.endWithError();
        }
        connection().setAuthenticated(false);
        connection().closeServer();
        onError.accept(error);
    }
}
