/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.processor;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.classicrouter.proxy.internal.ClassicConnection;
import io.classicrouter.proxy.internal.tracing.TraceSpan;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.protocol.ServerMode;
import io.classicrouter.proxy.protocol.ServerSideProtocolState;
import io.classicrouter.proxy.service.PooledConnection;
import io.classicrouter.proxy.service.ServerChannel;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Attaches a server connection to the client connection: an idle one from the pool if there is
 * one, a fresh one otherwise.
 * <p>
 * A pooled connection comes with the protocol state of its last user, including its server
 * greeting. A fresh connection has neither and still needs a handshake.
 * </p>
 */
public class ConnectProcessor extends Processor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectProcessor.class);

    public static final ServerError CONNECT_FAILED = new ServerError(2003, "Can't connect to remote MySQL server", ServerError.GENERAL_SQL_STATE);

    private enum Stage {
        INIT,
        CONNECTED,
        DONE
    }

    private final Consumer<ServerError> onError;
    private final @Nullable TraceSpan parentSpan;

    private Stage stage = Stage.INIT;
    private @Nullable TraceSpan span;
    private @Nullable ServerChannel connected;
    private @Nullable Throwable cause;

    public ConnectProcessor(ClassicConnection connection, Consumer<ServerError> onError, @Nullable TraceSpan parentSpan) {
        super(connection);
        this.onError = Objects.requireNonNull(onError);
        this.parentSpan = parentSpan;
    }

    @Override
    public Result process() {
        return switch (stage) {
            case INIT -> init();
            case CONNECTED -> connected();
            case DONE -> Result.DONE;
        };
    }

    private Result init() {
        ServerMode mode = connection().expectedServerMode();
        span = TraceSpan.start(connection().context().tracer(), "mysql/connect", parentSpan)
                .setAttribute("mysql.remote.server_mode", mode.name());

        Optional<PooledConnection> pooled = connection().context().connectionPool().pop(mode);
        if (pooled.isPresent() && pooled.get().channel().isOpen()) {
            LOGGER.debug("{}: using pooled {} server connection", connection().connectionId(), mode);

            connection().attachServer(pooled.get().channel(), pooled.get().protocol());
            span.setAttribute("mysql.remote.from_pool", true).end();

            stage = Stage.DONE;
            return Result.DONE;
        }
        pooled.ifPresent(stale -> stale.channel().close());

        LOGGER.debug("{}: opening {} server connection", connection().connectionId(), mode);

        stage = Stage.CONNECTED;
        return suspendUntil(connection().context().serverConnector().connect(mode), (channel, failure) -> {
            connected = channel;
            cause = failure;
        });
    }

    private Result connected() {
        stage = Stage.DONE;

        TraceSpan connectSpan = Objects.requireNonNull(span);
        connectSpan.setAttribute("mysql.remote.from_pool", false);

        Throwable failure = cause;
        ServerChannel channel = connected;
        if (failure != null || channel == null) {
            ServerError error = failure != null && isServerError(failure) ? toServerError(failure) : CONNECT_FAILED;

            LOGGER.warn("{}: connecting to {} server failed: {}",
                    connection().connectionId(), connection().expectedServerMode(),
                    failure != null ? failure.getMessage() : "no connection");
            connectSpan.endWithError();
            onError.accept(error);
            return Result.DONE;
        }

        connection().attachServer(channel, new ServerSideProtocolState());
        connectSpan.end();
        return Result.DONE;
    }
}
