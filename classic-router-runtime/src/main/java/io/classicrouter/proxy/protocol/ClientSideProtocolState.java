/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Protocol state of the client side of a connection, as the client sees it.
 */
public class ClientSideProtocolState extends ClassicProtocolState {

    private @Nullable String password;
    private int statusFlags;

    /**
     * The client's password, if the router learned it during the client's authentication.
     */
    public Optional<String> password() {
        return Optional.ofNullable(password);
    }

    public void setPassword(@Nullable String password) {
        this.password = password;
    }

    public int statusFlags() {
        return statusFlags;
    }

    public void setStatusFlags(int statusFlags) {
        this.statusFlags = statusFlags;
    }

    @Override
    public String toString() {
        return "ClientSideProtocolState{" +
                "username='" + username() + '\'' +
                ", schema='" + schema() + '\'' +
                ", capabilities=" + clientCapabilities() +
                '}';
    }
}
