/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

/**
 * End of rows of a resultset.
 *
 * @param statusFlags server status flags
 * @param warningCount number of warnings
 */
public record Eof(int statusFlags, int warningCount) {}
