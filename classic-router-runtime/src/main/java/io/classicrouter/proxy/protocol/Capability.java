/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

/**
 * Capability flags negotiated in the classic protocol handshake.
 */
public enum Capability {
    LONG_PASSWORD(0),
    FOUND_ROWS(1),
    LONG_FLAG(2),
    CONNECT_WITH_SCHEMA(3),
    COMPRESS(5),
    LOCAL_FILES(7),
    PROTOCOL_41(9),
    SSL(11),
    TRANSACTIONS(13),
    SECURE_CONNECTION(15),
    MULTI_STATEMENTS(16),
    MULTI_RESULTS(17),
    PS_MULTI_RESULTS(18),
    PLUGIN_AUTH(19),
    CONNECT_ATTRIBUTES(20),
    SESSION_TRACK(23),
    TEXT_RESULT_WITH_SESSION_TRACKING(24),
    QUERY_ATTRIBUTES(27);

    private final int position;

    Capability(int position) {
        this.position = position;
    }

    /**
     * Bit position of the flag in the capability bitmask.
     */
    public int position() {
        return position;
    }
}
