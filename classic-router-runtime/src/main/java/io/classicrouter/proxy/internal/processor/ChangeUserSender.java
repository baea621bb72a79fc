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
import io.classicrouter.proxy.protocol.HandshakeResponse;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.service.ServerChannel;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Re-authenticates a pooled server connection as the client's user.
 */
public class ChangeUserSender extends ServerCommandProcessor<Void> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeUserSender.class);

    private final Consumer<ServerError> onError;
    private final @Nullable TraceSpan parentSpan;
    private @Nullable HandshakeResponse handshakeResponse;
    private @Nullable TraceSpan span;

    public ChangeUserSender(ClassicConnection connection, Consumer<ServerError> onError, @Nullable TraceSpan parentSpan) {
        super(connection);
        this.onError = Objects.requireNonNull(onError);
        this.parentSpan = parentSpan;
    }

    @Override
    protected CompletionStage<Void> send(ServerChannel channel) {
        handshakeResponse = HandshakeResponse.of(connection().clientProtocol());
        span = TraceSpan.start(connection().context().tracer(), "mysql/change_user", parentSpan)
                .setAttribute("mysql.remote.username", handshakeResponse.username());
        return channel.changeUser(handshakeResponse);
    }

    @Override
    protected void onSuccess(@Nullable Void response) {
        connection().serverProtocol().authenticatedAs(Objects.requireNonNull(handshakeResponse));
        connection().setAuthenticated(true);
        if (span != null) {
            span.end();
        }
    }

    @Override
    protected void onFailure(ServerError error) {
        LOGGER.debug("{}: change-user failed: {}", connection().connectionId(), error.message());
        if (span != null) {
            span.endWithError();
        }
        connection().setAuthenticated(false);
        onError.accept(error);
        connection().closeServer();
    }
}
