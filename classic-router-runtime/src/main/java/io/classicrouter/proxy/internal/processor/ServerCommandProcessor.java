/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.processor;

import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.classicrouter.proxy.internal.ClassicConnection;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.service.ServerChannel;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Sends one command to the attached server and handles its response.
 *
 * @param <T> type of the command's response
 */
public abstract class ServerCommandProcessor<T> extends Processor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerCommandProcessor.class);

    private enum Stage {
        COMMAND,
        RESPONSE,
        DONE
    }

    private Stage stage = Stage.COMMAND;
    private @Nullable T response;
    private @Nullable Throwable cause;

    protected ServerCommandProcessor(ClassicConnection connection) {
        super(connection);
    }

    @Override
    public Result process() {
        return switch (stage) {
            case COMMAND -> command();
            case RESPONSE -> response();
            case DONE -> Result.DONE;
        };
    }

    private Result command() {
        ServerChannel channel = connection().serverChannel();
        if (channel == null || !channel.isOpen()) {
            LOGGER.debug("{}: {} without an open server connection",
                    connection().connectionId(), getClass().getSimpleName());
            stage = Stage.DONE;
            onFailure(LOST_CONNECTION);
            return Result.AGAIN;
        }

        stage = Stage.RESPONSE;
        return suspendUntil(send(channel), (value, failure) -> {
            response = value;
            cause = failure;
        });
    }

    private Result response() {
        stage = Stage.DONE;

        Throwable failure = cause;
        if (failure != null) {
            if (!isServerError(failure)) {
                LOGGER.warn("{}: {} failed: {}",
                        connection().connectionId(), getClass().getSimpleName(), failure.getMessage());
            }
            onFailure(toServerError(failure));
        }
        else {
            onSuccess(response);
        }
        return Result.DONE;
    }

    /**
     * Sends the command.
     */
    protected abstract CompletionStage<T> send(ServerChannel channel);

    /**
     * Called when the server accepted the command.
     */
    protected abstract void onSuccess(@Nullable T response);

    /**
     * Called when the server rejected the command or the connection broke.
     */
    protected abstract void onFailure(ServerError error);
}
