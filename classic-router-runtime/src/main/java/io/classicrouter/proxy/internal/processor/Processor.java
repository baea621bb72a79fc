/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.processor;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;

import io.classicrouter.proxy.internal.ClassicConnection;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.protocol.ServerErrorException;

/**
 * A resumable step-wise state machine, run by the {@link ClassicConnection} it was pushed on.
 * <p>
 * Each call of {@link #process()} does one step of work and tells the connection how to continue.
 * </p>
 */
public abstract class Processor {

    /**
     * How the connection continues after a step.
     */
    public enum Result {
        /** Call the top of the processor stack again. */
        AGAIN,
        /** Wait until something resumes the connection. */
        SUSPEND,
        /** Flush what was written to the client, then call again. */
        SEND_TO_CLIENT,
        /** The processor is finished and gets popped. */
        DONE
    }

    /**
     * Error for a server connection that broke while a command was in flight.
     */
    public static final ServerError LOST_CONNECTION = new ServerError(2013, "Lost connection to MySQL server during query", ServerError.GENERAL_SQL_STATE);

    private final ClassicConnection connection;

    protected Processor(ClassicConnection connection) {
        this.connection = Objects.requireNonNull(connection);
    }

    public ClassicConnection connection() {
        return connection;
    }

    /**
     * Does the next step.
     */
    public abstract Result process();

    /**
     * Suspends until {@code pending} completes, then hands its outcome to {@code onComplete} and
     * resumes the connection.
     */
    protected <T> Result suspendUntil(CompletionStage<T> pending, BiConsumer<? super T, ? super Throwable> onComplete) {
        pending.whenComplete((value, cause) -> {
            onComplete.accept(value, cause);
            connection.resume();
        });
        return Result.SUSPEND;
    }

    /**
     * Maps the failure of a server command to the error to report.
     */
    protected static ServerError toServerError(Throwable cause) {
        Throwable unwrapped = cause;
        while (unwrapped instanceof CompletionException && unwrapped.getCause() != null) {
            unwrapped = unwrapped.getCause();
        }
        if (unwrapped instanceof ServerErrorException see) {
            return see.error();
        }
        return LOST_CONNECTION;
    }

    /**
     * @return true if {@code cause} is an error message from the server, rather than a broken connection
     */
    protected static boolean isServerError(Throwable cause) {
        Throwable unwrapped = cause;
        while (unwrapped instanceof CompletionException && unwrapped.getCause() != null) {
            unwrapped = unwrapped.getCause();
        }
        return unwrapped instanceof ServerErrorException;
    }
}
