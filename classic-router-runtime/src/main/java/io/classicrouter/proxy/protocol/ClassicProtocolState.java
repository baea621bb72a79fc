/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * State of one side of a classic protocol connection that is shared by the client and the
 * server side: the authenticated identity, the default schema and the negotiated capabilities.
 */
public abstract class ClassicProtocolState {

    private String username = "";
    private String schema = "";
    private Map<String, String> sentAttributes = Map.of();
    private Set<Capability> clientCapabilities = EnumSet.noneOf(Capability.class);

    public String username() {
        return username;
    }

    public void setUsername(String username) {
        this.username = Objects.requireNonNull(username);
    }

    public String schema() {
        return schema;
    }

    public void setSchema(String schema) {
        this.schema = Objects.requireNonNull(schema);
    }

    /**
     * Connection attributes as sent by the client in its handshake response.
     */
    public Map<String, String> sentAttributes() {
        return sentAttributes;
    }

    public void setSentAttributes(Map<String, String> sentAttributes) {
        this.sentAttributes = Map.copyOf(sentAttributes);
    }

    /**
     * Capabilities the client side of this connection has negotiated.
     */
    public Set<Capability> clientCapabilities() {
        return clientCapabilities.isEmpty() ? EnumSet.noneOf(Capability.class) : EnumSet.copyOf(clientCapabilities);
    }

    public void setClientCapabilities(Set<Capability> clientCapabilities) {
        this.clientCapabilities = clientCapabilities.isEmpty() ? EnumSet.noneOf(Capability.class) : EnumSet.copyOf(clientCapabilities);
    }

    public boolean hasClientCapability(Capability capability) {
        return clientCapabilities.contains(capability);
    }
}
