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
 * Says goodbye to the server and closes the server connection.
 */
public class QuitSender extends ServerCommandProcessor<Void> {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuitSender.class);

    public QuitSender(ClassicConnection connection) {
        super(connection);
    }

    @Override
    protected CompletionStage<Void> send(ServerChannel channel) {
        return channel.quit();
    }

    @Override
    protected void onSuccess(@Nullable Void response) {
        connection().closeServer();
    }

    @Override
    protected void onFailure(ServerError error) {
        LOGGER.debug("{}: quit failed, closing anyway: {}", connection().connectionId(), error.message());
        connection().closeServer();
    }
}
