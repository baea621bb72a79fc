/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.processor;

import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.classicrouter.proxy.internal.ClassicConnection;
import io.classicrouter.proxy.internal.tracing.TraceSpan;
import io.classicrouter.proxy.protocol.HandshakeResponse;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.protocol.ServerGreeting;
import io.classicrouter.proxy.service.ServerChannel;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Runs the full handshake on a fresh server connection: reads the server's greeting and
 * authenticates as the client's user.
 * <p>
 * If either step fails, the error callback runs while the server side still shows whether the
 * greeting was received, then the server connection is closed.
 * </p>
 */
public class ServerGreetor extends Processor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerGreetor.class);

    private enum Stage {
        GREETING,
        GREETING_RESPONSE,
        AUTH_RESPONSE,
        DONE
    }

    private final Consumer<ServerError> onError;
    private final @Nullable TraceSpan parentSpan;

    private Stage stage = Stage.GREETING;
    private @Nullable TraceSpan span;
    private @Nullable ServerGreeting greeting;
    private @Nullable HandshakeResponse handshakeResponse;
    private @Nullable Throwable cause;

    public ServerGreetor(ClassicConnection connection, Consumer<ServerError> onError, @Nullable TraceSpan parentSpan) {
        super(connection);
        this.onError = Objects.requireNonNull(onError);
        this.parentSpan = parentSpan;
    }

    @Override
    public Result process() {
        return switch (stage) {
            case GREETING -> greeting();
            case GREETING_RESPONSE -> greetingResponse();
            case AUTH_RESPONSE -> authResponse();
            case DONE -> Result.DONE;
        };
    }

    private Result greeting() {
        span = TraceSpan.start(connection().context().tracer(), "mysql/greeting", parentSpan);

        ServerChannel channel = connection().serverChannel();
        if (channel == null || !channel.isOpen()) {
            return failed(LOST_CONNECTION);
        }

        stage = Stage.GREETING_RESPONSE;
        return suspendUntil(channel.greeting(), (value, failure) -> {
            greeting = value;
            cause = failure;
        });
    }

    private Result greetingResponse() {
        Throwable failure = cause;
        if (failure != null) {
            return failed(toServerError(failure));
        }

        ServerGreeting serverGreeting = Objects.requireNonNull(greeting);
        connection().serverProtocol().setServerGreeting(serverGreeting);
        Objects.requireNonNull(span).setAttribute("mysql.remote.server_version", serverGreeting.serverVersion());

        ServerChannel channel = connection().serverChannel();
        if (channel == null || !channel.isOpen()) {
            return failed(LOST_CONNECTION);
        }

        handshakeResponse = HandshakeResponse.of(connection().clientProtocol());

        stage = Stage.AUTH_RESPONSE;
        return suspendUntil(channel.authenticate(handshakeResponse), (value, authFailure) -> cause = authFailure);
    }

    private Result authResponse() {
        Throwable failure = cause;
        if (failure != null) {
            return failed(toServerError(failure));
        }

        connection().serverProtocol().authenticatedAs(Objects.requireNonNull(handshakeResponse));
        connection().setAuthenticated(true);
        Objects.requireNonNull(span).end();

        stage = Stage.DONE;
        return Result.DONE;
    }

    private Result failed(ServerError error) {
        LOGGER.debug("{}: server handshake failed: {} ({})",
                connection().connectionId(), error.message(), error.code());

        if (span != null) {
            span.endWithError();
        }
        connection().setAuthenticated(false);
        onError.accept(error);
        connection().closeServer();

        stage = Stage.DONE;
        return Result.DONE;
    }
}
