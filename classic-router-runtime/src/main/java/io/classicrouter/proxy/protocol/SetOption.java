/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

/**
 * Options of the COM_SET_OPTION command.
 */
public enum SetOption {
    MULTI_STATEMENTS_ON(0),
    MULTI_STATEMENTS_OFF(1);

    private final int code;

    SetOption(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static SetOption multiStatements(boolean enabled) {
        return enabled ? MULTI_STATEMENTS_ON : MULTI_STATEMENTS_OFF;
    }
}
