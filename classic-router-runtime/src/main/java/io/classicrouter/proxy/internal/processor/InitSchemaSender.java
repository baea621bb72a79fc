/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.processor;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

import io.classicrouter.proxy.internal.ClassicConnection;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.service.ServerChannel;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Changes the default schema of the server connection.
 */
public class InitSchemaSender extends ServerCommandProcessor<Void> {

    private final String schema;
    private final Consumer<ServerError> onError;

    public InitSchemaSender(ClassicConnection connection, String schema, Consumer<ServerError> onError) {
        super(connection);
        this.schema = Objects.requireNonNull(schema);
        this.onError = Objects.requireNonNull(onError);
    }

    @Override
    protected CompletionStage<Void> send(ServerChannel channel) {
        return channel.initSchema(schema);
    }

    @Override
    protected void onSuccess(@Nullable Void response) {
        connection().serverProtocol().setSchema(schema);
    }

    @Override
    protected void onFailure(ServerError error) {
        onError.accept(error);
    }
}
