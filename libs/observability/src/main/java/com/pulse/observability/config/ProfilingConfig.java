package com.pulse.observability.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Continuous profiling settings.
 *
 * @param enabled          construct a profiler at all (default false)
 * @param applicationName  name recordings are filed under; blank means the service name
 * @param settings         JDK Flight Recorder configuration name, "default" or "profile" (default "profile")
 * @param outputDirectory  where recordings are written on stop; null means the system temp directory
 * @param samplingInterval period between execution samples (default 20ms)
 */
public record ProfilingConfig(
        boolean enabled,
        String applicationName,
        String settings,
        Path outputDirectory,
        Duration samplingInterval
) {

    public static final String DEFAULT_SETTINGS = "profile";
    public static final Duration DEFAULT_SAMPLING_INTERVAL = Duration.ofMillis(20);

    public ProfilingConfig {
        if (applicationName == null) {
            applicationName = "";
        }
        if (settings == null || settings.isBlank()) {
            settings = DEFAULT_SETTINGS;
        }
        if (samplingInterval == null) {
            samplingInterval = DEFAULT_SAMPLING_INTERVAL;
        }
    }

    public static ProfilingConfig defaults() {
        return new ProfilingConfig(false, null, null, null, null);
    }

    public ProfilingConfig withEnabled(boolean enabled) {
        return new ProfilingConfig(enabled, applicationName, settings, outputDirectory, samplingInterval);
    }

    public ProfilingConfig withOutputDirectory(Path outputDirectory) {
        return new ProfilingConfig(enabled, applicationName, settings, outputDirectory, samplingInterval);
    }
}
