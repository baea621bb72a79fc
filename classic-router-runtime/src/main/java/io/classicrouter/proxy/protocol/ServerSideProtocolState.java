/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Protocol state of the server side of a connection.
 * <p>
 * A server connection that has a {@link #serverGreeting()} has been through a handshake
 * already, which is the case for connections taken from the connection pool.
 * </p>
 */
public class ServerSideProtocolState extends ClassicProtocolState {

    /**
     * Sequence id marking "no command in flight": the next message starts a new command.
     */
    public static final int SEQ_ID_NEW_COMMAND = 0xff;

    private @Nullable ServerGreeting serverGreeting;
    private int seqId = SEQ_ID_NEW_COMMAND;

    public Optional<ServerGreeting> serverGreeting() {
        return Optional.ofNullable(serverGreeting);
    }

    public void setServerGreeting(@Nullable ServerGreeting serverGreeting) {
        this.serverGreeting = serverGreeting;
    }

    public int seqId() {
        return seqId;
    }

    public void setSeqId(int seqId) {
        this.seqId = seqId;
    }

    /**
     * Takes over the identity of {@code response} after the server accepted it.
     */
    public void authenticatedAs(HandshakeResponse response) {
        setUsername(response.username());
        setSchema(response.schema());
        setSentAttributes(response.attributes());
        setClientCapabilities(response.capabilities());
    }

    @Override
    public String toString() {
        return "ServerSideProtocolState{" +
                "username='" + username() + '\'' +
                ", schema='" + schema() + '\'' +
                ", greeting=" + (serverGreeting != null) +
                ", seqId=" + seqId +
                '}';
    }
}
