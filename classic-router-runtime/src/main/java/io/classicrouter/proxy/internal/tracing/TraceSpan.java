/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.tracing;

import java.util.Objects;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A span covering one phase of the router's work on a connection.
 * <p>
 * A span is ended exactly once: ending it again has no effect, so every exit path of a phase
 * may end it.
 * </p>
 */
public final class TraceSpan {

    private final Span span;
    private boolean ended;

    private TraceSpan(Span span) {
        this.span = span;
    }

    /**
     * Starts a span.
     *
     * @param tracer tracer
     * @param name name of the span, like {@code mysql/set_schema}
     * @param parent parent span, or null to start a span under the current context
     * @return started span
     */
    public static TraceSpan start(Tracer tracer, String name, @Nullable TraceSpan parent) {
        SpanBuilder builder = tracer.spanBuilder(name);
        if (parent != null) {
            builder.setParent(Context.root().with(parent.span));
        }
        return new TraceSpan(builder.startSpan());
    }

    public TraceSpan setAttribute(String key, String value) {
        span.setAttribute(key, value);
        return this;
    }

    public TraceSpan setAttribute(String key, boolean value) {
        span.setAttribute(key, value);
        return this;
    }

    public TraceSpan setAttribute(String key, long value) {
        span.setAttribute(key, value);
        return this;
    }

    /**
     * Ends the span with status OK.
     */
    public void end() {
        end(StatusCode.OK);
    }

    /**
     * Ends the span with status ERROR.
     */
    public void endWithError() {
        end(StatusCode.ERROR);
    }

    public void end(StatusCode statusCode) {
        Objects.requireNonNull(statusCode);
        if (ended) {
            return;
        }
        ended = true;
        span.setStatus(statusCode);
        span.end();
    }

    public boolean isEnded() {
        return ended;
    }

    public Span span() {
        return span;
    }
}
