/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.processor;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

import io.classicrouter.proxy.internal.ClassicConnection;
import io.classicrouter.proxy.protocol.Capability;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.protocol.SetOption;
import io.classicrouter.proxy.service.ServerChannel;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Switches the multi-statement option of the server connection.
 */
public class SetOptionSender extends ServerCommandProcessor<Void> {

    private final SetOption option;
    private final Consumer<ServerError> onError;

    public SetOptionSender(ClassicConnection connection, SetOption option, Consumer<ServerError> onError) {
        super(connection);
        this.option = Objects.requireNonNull(option);
        this.onError = Objects.requireNonNull(onError);
    }

    @Override
    protected CompletionStage<Void> send(ServerChannel channel) {
        return channel.setOption(option);
    }

    @Override
    protected void onSuccess(@Nullable Void response) {
        var serverProtocol = connection().serverProtocol();
        Set<Capability> capabilities = serverProtocol.clientCapabilities();
        if (option == SetOption.MULTI_STATEMENTS_ON) {
            capabilities.add(Capability.MULTI_STATEMENTS);
        }
        else {
            capabilities.remove(Capability.MULTI_STATEMENTS);
        }
        serverProtocol.setClientCapabilities(capabilities);
    }

    @Override
    protected void onFailure(ServerError error) {
        onError.accept(error);
    }
}
