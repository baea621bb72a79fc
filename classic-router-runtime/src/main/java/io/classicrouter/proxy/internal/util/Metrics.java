/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;

import static io.micrometer.core.instrument.Metrics.globalRegistry;

/**
 * Meters of the runtime, registered on the global registry.
 */
public final class Metrics {

    public static final String LAZY_CONNECT_RETRIES = "classic_router_lazy_connect_retries";
    public static final String LAZY_CONNECT_FALLBACKS = "classic_router_lazy_connect_fallbacks";
    public static final String LAZY_CONNECT_FAILURES = "classic_router_lazy_connect_failures";

    private Metrics() {
    }

    public static Meter.MeterProvider<Counter> lazyConnectRetryCounter() {
        return Counter.builder(LAZY_CONNECT_RETRIES)
                .description("Connect attempts retried after a transient error from the server")
                .withRegistry(globalRegistry);
    }

    public static Meter.MeterProvider<Counter> lazyConnectFallbackCounter() {
        return Counter.builder(LAZY_CONNECT_FALLBACKS)
                .description("Read-only connects that fell back to a read-write server")
                .withRegistry(globalRegistry);
    }

    public static Meter.MeterProvider<Counter> lazyConnectFailureCounter() {
        return Counter.builder(LAZY_CONNECT_FAILURES)
                .description("Lazy connects that reported an error to the client")
                .withRegistry(globalRegistry);
    }
}
