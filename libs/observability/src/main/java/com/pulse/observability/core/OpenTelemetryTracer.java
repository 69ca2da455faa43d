package com.pulse.observability.core;

import com.pulse.observability.ServiceIdentity;
import com.pulse.observability.spi.PulseTracer;
import com.pulse.observability.spi.TelemetryCore;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * {@link PulseTracer} over an OpenTelemetry {@link Tracer}.
 * <p>
 * While a span is current its trace and span ids are published in the SLF4J MDC under
 * {@value #MDC_TRACE_ID} and {@value #MDC_SPAN_ID}, so log lines written inside the span can be
 * joined to it. The previous MDC values are restored when the span ends.
 */
public final class OpenTelemetryTracer implements PulseTracer {

    /** MDC key for the current trace id. */
    public static final String MDC_TRACE_ID = "traceId";

    /** MDC key for the current span id. */
    public static final String MDC_SPAN_ID = "spanId";

    private final Tracer tracer;

    public OpenTelemetryTracer(ServiceIdentity identity, TelemetryCore core) {
        this(core.openTelemetry().getTracer(identity.name(), identity.version()));
    }

    /**
     * Creates a tracer helper backed by the given OTel tracer.
     */
    public OpenTelemetryTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    @Override
    public <T> T withSpan(String spanName, Callable<T> callable) throws Exception {
        return withSpan(spanName, SpanKind.INTERNAL, Map.of(), callable);
    }

    @Override
    public <T> T withSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                          Callable<T> callable) throws Exception {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        String previousTraceId = MDC.get(MDC_TRACE_ID);
        String previousSpanId = MDC.get(MDC_SPAN_ID);
        SpanContext spanContext = span.getSpanContext();
        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        }

        try (Scope ignored = span.makeCurrent()) {
            T result = callable.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
            restoreMdc(MDC_TRACE_ID, previousTraceId);
            restoreMdc(MDC_SPAN_ID, previousSpanId);
        }
    }

    @Override
    public void withSpan(String spanName, Runnable runnable) {
        try {
            withSpan(spanName, () -> {
                runnable.run();
                return null;
            });
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected checked exception in span " + spanName, e);
        }
    }

    @Override
    public Tracer tracer() {
        return tracer;
    }

    private static void restoreMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
