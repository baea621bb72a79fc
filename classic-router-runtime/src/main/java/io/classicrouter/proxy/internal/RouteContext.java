/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal;

import java.time.Clock;
import java.util.Objects;

import io.netty.util.Timer;
import io.opentelemetry.api.trace.Tracer;

import io.classicrouter.proxy.config.RouteConfig;
import io.classicrouter.proxy.service.ConnectionPool;
import io.classicrouter.proxy.service.ServerConnector;

/**
 * Route-wide configuration and services shared by all connections of a route.
 */
public class RouteContext {

    private final RouteConfig config;
    private final ServerConnector serverConnector;
    private final ConnectionPool connectionPool;
    private final Tracer tracer;
    private final Timer timer;
    private final Clock clock;

    public RouteContext(
                        RouteConfig config,
                        ServerConnector serverConnector,
                        ConnectionPool connectionPool,
                        Tracer tracer,
                        Timer timer,
                        Clock clock) {
        this.config = Objects.requireNonNull(config);
        this.serverConnector = Objects.requireNonNull(serverConnector);
        this.connectionPool = Objects.requireNonNull(connectionPool);
        this.tracer = Objects.requireNonNull(tracer);
        this.timer = Objects.requireNonNull(timer);
        this.clock = Objects.requireNonNull(clock);
    }

    public RouteConfig config() {
        return config;
    }

    public ServerConnector serverConnector() {
        return serverConnector;
    }

    public ConnectionPool connectionPool() {
        return connectionPool;
    }

    public Tracer tracer() {
        return tracer;
    }

    /**
     * Timer for the connect retries of all connections of this route.
     */
    public Timer timer() {
        return timer;
    }

    public Clock clock() {
        return clock;
    }
}
