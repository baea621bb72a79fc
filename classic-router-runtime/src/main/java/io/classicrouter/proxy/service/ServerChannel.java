/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.service;

import java.util.concurrent.CompletionStage;

import io.classicrouter.proxy.protocol.HandshakeResponse;
import io.classicrouter.proxy.protocol.ServerGreeting;
import io.classicrouter.proxy.protocol.SetOption;

/**
 * An open connection to a MySQL server, speaking the classic protocol.
 *
 * <p>Implementations own the transport and the message codec. Each command is asynchronous:
 * the returned stage completes once the server's response has been read. A command the
 * server answers with an error message fails with a
 * {@link io.classicrouter.proxy.protocol.ServerErrorException}; any other failure means the
 * connection is broken.</p>
 *
 * <p>Stages must be completed on the event loop of the client connection the channel is
 * currently attached to.</p>
 */
public interface ServerChannel {

    /**
     * @return true while the transport is connected
     */
    boolean isOpen();

    /**
     * Reads the server's initial handshake message.
     */
    CompletionStage<ServerGreeting> greeting();

    /**
     * Runs the authentication exchange for a freshly greeted connection.
     */
    CompletionStage<Void> authenticate(HandshakeResponse response);

    /**
     * Sends COM_CHANGE_USER, re-authenticating a connection that was already authenticated.
     */
    CompletionStage<Void> changeUser(HandshakeResponse response);

    /**
     * Sends COM_RESET_CONNECTION.
     */
    CompletionStage<Void> resetConnection();

    /**
     * Sends COM_SET_OPTION.
     */
    CompletionStage<Void> setOption(SetOption option);

    /**
     * Sends COM_INIT_DB.
     */
    CompletionStage<Void> initSchema(String schema);

    /**
     * Sends COM_QUERY and streams the response into {@code handler}.
     * <p>
     * Server errors are reported through {@link QueryHandler#onError}, the stage
     * only fails if the connection broke.
     * </p>
     */
    CompletionStage<Void> query(String statement, QueryHandler handler);

    /**
     * Sends COM_QUIT and closes the transport.
     */
    CompletionStage<Void> quit();

    /**
     * Closes the transport without telling the server.
     */
    void close();
}
