/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

/**
 * Role a client expects of the server it gets connected to.
 */
public enum ServerMode {
    READ_WRITE,
    READ_ONLY,
    UNAVAILABLE
}
