package com.pulse.observability.core;

import com.pulse.observability.ServiceIdentity;
import com.pulse.observability.config.ProfilingConfig;
import com.pulse.observability.config.RecordingConfig;
import com.pulse.observability.config.TelemetryConfig;
import com.pulse.observability.spi.Profiler;
import com.pulse.observability.spi.PulseLogger;
import com.pulse.observability.spi.PulseMetrics;
import com.pulse.observability.spi.PulseTracer;
import com.pulse.observability.spi.Recorder;
import com.pulse.observability.spi.SubsystemProvider;
import com.pulse.observability.spi.TelemetryCore;
import io.opentelemetry.sdk.trace.export.SpanExporter;

import java.util.List;

/**
 * Production collaborators: OpenTelemetry and Micrometer for telemetry, SLF4J for logs, JFR for
 * profiling and {@link FileRecorder} for recording.
 */
public final class DefaultSubsystemProvider implements SubsystemProvider {

    private final List<SpanExporter> spanExporters;

    public DefaultSubsystemProvider() {
        this(List.of());
    }

    /**
     * @param spanExporters extra exporters every finished span is sent to, in addition to OTLP
     */
    public DefaultSubsystemProvider(List<SpanExporter> spanExporters) {
        this.spanExporters = List.copyOf(spanExporters);
    }

    @Override
    public TelemetryCore createTelemetryCore(ServiceIdentity identity, TelemetryConfig config) {
        return OpenTelemetryCore.create(identity, config, spanExporters);
    }

    @Override
    public PulseLogger createLogger(ServiceIdentity identity, TelemetryCore core) {
        return new Slf4jPulseLogger(identity, core);
    }

    @Override
    public PulseMetrics createMetrics(ServiceIdentity identity, TelemetryCore core) {
        return new MicrometerMetrics(identity, core);
    }

    @Override
    public PulseTracer createTracer(ServiceIdentity identity, TelemetryCore core) {
        return new OpenTelemetryTracer(identity, core);
    }

    @Override
    public Profiler createProfiler(ServiceIdentity identity, ProfilingConfig config) throws Exception {
        return JfrProfiler.start(identity, config);
    }

    @Override
    public Recorder createRecorder(RecordingConfig config) throws Exception {
        return FileRecorder.open(config);
    }
}
