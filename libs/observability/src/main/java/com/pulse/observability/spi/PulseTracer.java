package com.pulse.observability.spi;

import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Runs units of work inside spans.
 * <p>
 * A span ends when its unit of work returns or throws. A thrown exception marks the span as an
 * error and is rethrown unchanged.
 */
public interface PulseTracer {

    /**
     * Runs the callable inside an internal span.
     *
     * @param spanName name of the span
     * @param callable the unit of work
     * @param <T>      result type
     * @return the callable's result
     * @throws Exception whatever the callable throws
     */
    <T> T withSpan(String spanName, Callable<T> callable) throws Exception;

    /**
     * Runs the callable inside a span of the given kind and attributes.
     *
     * @param spanName   name of the span
     * @param kind       span kind (e.g., {@link SpanKind#SERVER} for request handling)
     * @param attributes string attributes set on the span before it starts
     * @param callable   the unit of work
     * @param <T>        result type
     * @return the callable's result
     * @throws Exception whatever the callable throws
     */
    <T> T withSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                   Callable<T> callable) throws Exception;

    /**
     * Runs the runnable inside an internal span.
     *
     * @param spanName name of the span
     * @param runnable the unit of work
     */
    void withSpan(String spanName, Runnable runnable);

    /**
     * Returns the underlying OpenTelemetry tracer for manual instrumentation.
     *
     * @return the tracer spans are started from
     */
    Tracer tracer();
}
