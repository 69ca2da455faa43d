package com.pulse.observability.config;

import java.time.Duration;

/**
 * Settings for the telemetry core and the logger, metrics and tracer registered on it.
 *
 * @param otlp            collector export settings
 * @param loggingEnabled  emit structured logs (default true)
 * @param metricsEnabled  record metrics (default true)
 * @param tracingEnabled  record spans (default true)
 * @param traceSampleRate fraction of root traces sampled, 0.0 to 1.0 (default 1.0)
 * @param metricsStep     metrics publishing interval (default 10s)
 * @param shutdownTimeout upper bound for flushing pending telemetry on shutdown (default 10s)
 */
public record TelemetryConfig(
        OtlpExportConfig otlp,
        boolean loggingEnabled,
        boolean metricsEnabled,
        boolean tracingEnabled,
        double traceSampleRate,
        Duration metricsStep,
        Duration shutdownTimeout
) {

    public static final double DEFAULT_TRACE_SAMPLE_RATE = 1.0;
    public static final Duration DEFAULT_METRICS_STEP = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    public TelemetryConfig {
        if (otlp == null) {
            otlp = OtlpExportConfig.defaults();
        }
        if (metricsStep == null) {
            metricsStep = DEFAULT_METRICS_STEP;
        }
        if (shutdownTimeout == null) {
            shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        }
    }

    public static TelemetryConfig defaults() {
        return new TelemetryConfig(null, true, true, true, DEFAULT_TRACE_SAMPLE_RATE, null, null);
    }

    public TelemetryConfig withOtlp(OtlpExportConfig otlp) {
        return new TelemetryConfig(otlp, loggingEnabled, metricsEnabled, tracingEnabled,
                traceSampleRate, metricsStep, shutdownTimeout);
    }

    public TelemetryConfig withLoggingEnabled(boolean loggingEnabled) {
        return new TelemetryConfig(otlp, loggingEnabled, metricsEnabled, tracingEnabled,
                traceSampleRate, metricsStep, shutdownTimeout);
    }

    public TelemetryConfig withMetricsEnabled(boolean metricsEnabled) {
        return new TelemetryConfig(otlp, loggingEnabled, metricsEnabled, tracingEnabled,
                traceSampleRate, metricsStep, shutdownTimeout);
    }

    public TelemetryConfig withTracingEnabled(boolean tracingEnabled) {
        return new TelemetryConfig(otlp, loggingEnabled, metricsEnabled, tracingEnabled,
                traceSampleRate, metricsStep, shutdownTimeout);
    }

    public TelemetryConfig withTraceSampleRate(double traceSampleRate) {
        return new TelemetryConfig(otlp, loggingEnabled, metricsEnabled, tracingEnabled,
                traceSampleRate, metricsStep, shutdownTimeout);
    }
}
