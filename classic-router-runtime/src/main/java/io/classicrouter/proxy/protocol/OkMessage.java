/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.protocol;

/**
 * OK message, sent by the server after a successful command, and by the router to the client
 * once a lazily connected server is ready.
 *
 * @param affectedRows affected rows
 * @param lastInsertId last insert id
 * @param statusFlags server status flags
 * @param warningCount number of warnings
 */
public record OkMessage(long affectedRows, long lastInsertId, int statusFlags, int warningCount) {}
