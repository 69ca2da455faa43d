package com.pulse.observability.spi;

import com.pulse.observability.ServiceIdentity;
import com.pulse.observability.config.ProfilingConfig;
import com.pulse.observability.config.RecordingConfig;
import com.pulse.observability.config.TelemetryConfig;

/**
 * Constructs the collaborators a {@link com.pulse.observability.Pulse} handle owns.
 * <p>
 * Each method may block on network or disk I/O. Any exception aborts startup.
 */
public interface SubsystemProvider {

    TelemetryCore createTelemetryCore(ServiceIdentity identity, TelemetryConfig config) throws Exception;

    PulseLogger createLogger(ServiceIdentity identity, TelemetryCore core) throws Exception;

    PulseMetrics createMetrics(ServiceIdentity identity, TelemetryCore core) throws Exception;

    PulseTracer createTracer(ServiceIdentity identity, TelemetryCore core) throws Exception;

    Profiler createProfiler(ServiceIdentity identity, ProfilingConfig config) throws Exception;

    Recorder createRecorder(RecordingConfig config) throws Exception;
}
