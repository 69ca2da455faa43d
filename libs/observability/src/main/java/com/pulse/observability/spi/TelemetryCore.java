package com.pulse.observability.spi;

import com.pulse.observability.ServiceIdentity;
import com.pulse.observability.config.TelemetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;

/**
 * Shared export plumbing that the logger, metrics and tracer register against.
 * <p>
 * Always constructed, even when logging, metrics and tracing are all disabled: the dependents
 * read {@link #config()} and decide for themselves whether to emit anything. Shutting the core
 * down flushes and releases everything registered through it.
 */
public interface TelemetryCore {

    ServiceIdentity identity();

    TelemetryConfig config();

    /**
     * Returns the OpenTelemetry instance spans are created from; a no-op instance when tracing
     * is disabled.
     */
    OpenTelemetry openTelemetry();

    /**
     * Returns the registry meters are registered on.
     */
    MeterRegistry meterRegistry();

    /**
     * Flushes pending telemetry and releases exporters.
     *
     * @throws Exception if flushing or shutting down an exporter fails
     */
    void shutdown() throws Exception;
}
