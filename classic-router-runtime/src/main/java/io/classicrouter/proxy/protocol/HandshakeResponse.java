/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

import java.util.Map;
import java.util.Set;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Identity the router presents to a server when authenticating or changing the user of a
 * server connection on behalf of a client.
 *
 * @param username account name
 * @param password the client's password if known to the router
 * @param schema default schema, may be empty
 * @param attributes connection attributes sent by the client
 * @param capabilities client capabilities to negotiate
 */
public record HandshakeResponse(
                                String username,
                                @Nullable String password,
                                String schema,
                                Map<String, String> attributes,
                                Set<Capability> capabilities) {

    public HandshakeResponse {
        attributes = Map.copyOf(attributes);
        capabilities = Set.copyOf(capabilities);
    }

    public static HandshakeResponse of(ClientSideProtocolState client) {
        return new HandshakeResponse(
                client.username(),
                client.password().orElse(null),
                client.schema(),
                client.sentAttributes(),
                client.clientCapabilities());
    }

    @Override
    public String toString() {
        return "HandshakeResponse{" +
                "username='" + username + '\'' +
                ", password=" + (password != null ? "***" : "<unknown>") +
                ", schema='" + schema + '\'' +
                ", attributes=" + attributes +
                '}';
    }
}
