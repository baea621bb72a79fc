/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.config;

import java.time.Duration;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration of a route, as far as connecting clients to servers is concerned.
 * <p>
 * Absent properties take their defaults.
 * </p>
 *
 * @param connectionSharing share server connections between clients via the connection pool
 * @param connectRetryTimeout how long to keep retrying a connect that failed with a transient error
 * @param connectRetryInterval pause between two connect attempts
 * @param routerRequireEnforce enforce the {@code router_require} user attribute
 * @param waitForMyWrites make read-only servers wait for the client's own writes
 * @param waitForMyWritesTimeout how long a read-only server may wait, zero to only check
 */
public record RouteConfig(
                          @Nullable Boolean connectionSharing,
                          @Nullable Duration connectRetryTimeout,
                          @Nullable Duration connectRetryInterval,
                          @Nullable Boolean routerRequireEnforce,
                          @Nullable Boolean waitForMyWrites,
                          @Nullable Duration waitForMyWritesTimeout) {

    public static final Duration DEFAULT_CONNECT_RETRY_TIMEOUT = Duration.ofSeconds(7);
    public static final Duration DEFAULT_CONNECT_RETRY_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_WAIT_FOR_MY_WRITES_TIMEOUT = Duration.ofSeconds(2);

    public RouteConfig {
        connectionSharing = Objects.requireNonNullElse(connectionSharing, false);
        connectRetryTimeout = nonNegative("connectRetryTimeout",
                Objects.requireNonNullElse(connectRetryTimeout, DEFAULT_CONNECT_RETRY_TIMEOUT));
        connectRetryInterval = nonNegative("connectRetryInterval",
                Objects.requireNonNullElse(connectRetryInterval, DEFAULT_CONNECT_RETRY_INTERVAL));
        routerRequireEnforce = Objects.requireNonNullElse(routerRequireEnforce, true);
        waitForMyWrites = Objects.requireNonNullElse(waitForMyWrites, true);
        waitForMyWritesTimeout = nonNegative("waitForMyWritesTimeout",
                Objects.requireNonNullElse(waitForMyWritesTimeout, DEFAULT_WAIT_FOR_MY_WRITES_TIMEOUT));
    }

    public static RouteConfig defaults() {
        return new RouteConfig(null, null, null, null, null, null);
    }

    public RouteConfig withConnectionSharing(boolean enabled) {
        return new RouteConfig(enabled, connectRetryTimeout, connectRetryInterval, routerRequireEnforce, waitForMyWrites, waitForMyWritesTimeout);
    }

    public RouteConfig withRouterRequireEnforce(boolean enabled) {
        return new RouteConfig(connectionSharing, connectRetryTimeout, connectRetryInterval, enabled, waitForMyWrites, waitForMyWritesTimeout);
    }

    public RouteConfig withWaitForMyWritesTimeout(Duration timeout) {
        return new RouteConfig(connectionSharing, connectRetryTimeout, connectRetryInterval, routerRequireEnforce, waitForMyWrites, timeout);
    }

    private static Duration nonNegative(String name, Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, was " + duration);
        }
        return duration;
    }
}
