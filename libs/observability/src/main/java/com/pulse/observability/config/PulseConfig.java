package com.pulse.observability.config;

/**
 * Root of the configuration tree.
 * <p>
 * Pure data: every field has a documented default, and the enabled flags of the profiling and
 * recording sub-configs are read once, when {@link com.pulse.observability.Pulse} is created.
 *
 * @param telemetry telemetry export (logging, metrics, tracing) settings
 * @param profiling continuous profiling settings
 * @param recording binary telemetry-log recording settings
 */
public record PulseConfig(
        TelemetryConfig telemetry,
        ProfilingConfig profiling,
        RecordingConfig recording
) {

    public PulseConfig {
        if (telemetry == null) {
            telemetry = TelemetryConfig.defaults();
        }
        if (profiling == null) {
            profiling = ProfilingConfig.defaults();
        }
        if (recording == null) {
            recording = RecordingConfig.defaults();
        }
    }

    /**
     * Returns the default tree: telemetry on without export, profiling and recording off.
     */
    public static PulseConfig defaults() {
        return new PulseConfig(null, null, null);
    }

    public PulseConfig withTelemetry(TelemetryConfig telemetry) {
        return new PulseConfig(telemetry, profiling, recording);
    }

    public PulseConfig withProfiling(ProfilingConfig profiling) {
        return new PulseConfig(telemetry, profiling, recording);
    }

    public PulseConfig withRecording(RecordingConfig recording) {
        return new PulseConfig(telemetry, profiling, recording);
    }
}
