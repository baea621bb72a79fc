/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.require;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * What a user account requires of the client's connection to the router, as set in the
 * {@code router_require} member of the account's user attributes:
 *
 * <pre>
 * ALTER USER 'app'@'%' ATTRIBUTE '{"router_require": {"ssl": true, "subject": "CN=app"}}'
 * </pre>
 *
 * @param ssl client connection must be TLS encrypted
 * @param x509 client must present a certificate
 * @param subject required subject of the client certificate
 * @param issuer required issuer of the client certificate
 */
public record RequiredConnectionAttributes(
                                           @Nullable Boolean ssl,
                                           @Nullable Boolean x509,
                                           @Nullable String subject,
                                           @Nullable String issuer) {

    public static final RequiredConnectionAttributes NONE = new RequiredConnectionAttributes(null, null, null, null);

    private static final String ROUTER_REQUIRE = "router_require";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * @return true if the client connection must be TLS encrypted
     */
    public boolean requiresTls() {
        return Boolean.TRUE.equals(ssl) || requiresCertificate();
    }

    /**
     * @return true if the client must present a certificate
     */
    public boolean requiresCertificate() {
        return Boolean.TRUE.equals(x509) || subject != null || issuer != null;
    }

    /**
     * Parses the user attributes of an account.
     *
     * @param userAttributes JSON document, or null if the account has no attributes
     * @return the requirements, {@link #NONE} if the attributes have no {@code router_require}
     * @throws IllegalArgumentException if the document isn't valid or has unexpected members
     */
    public static RequiredConnectionAttributes fromUserAttributes(@Nullable String userAttributes) {
        if (userAttributes == null || userAttributes.isBlank()) {
            return NONE;
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(userAttributes);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("user attributes are not valid JSON", e);
        }

        JsonNode require = root.get(ROUTER_REQUIRE);
        if (require == null || require.isNull()) {
            return NONE;
        }
        if (!require.isObject()) {
            throw new IllegalArgumentException(ROUTER_REQUIRE + " must be an object");
        }

        var fields = require.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!field.equals("ssl") && !field.equals("x509") && !field.equals("subject") && !field.equals("issuer")) {
                throw new IllegalArgumentException("unknown " + ROUTER_REQUIRE + " attribute: " + field);
            }
        }

        return new RequiredConnectionAttributes(
                booleanField(require, "ssl"),
                booleanField(require, "x509"),
                textField(require, "subject"),
                textField(require, "issuer"));
    }

    @Nullable
    private static Boolean booleanField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isBoolean()) {
            throw new IllegalArgumentException(ROUTER_REQUIRE + "." + field + " must be a boolean");
        }
        return value.booleanValue();
    }

    @Nullable
    private static String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new IllegalArgumentException(ROUTER_REQUIRE + "." + field + " must be a string");
        }
        return value.textValue();
    }
}
