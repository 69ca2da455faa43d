package com.pulse.observability.spi;

/**
 * Continuous profiler. Construction starts it; {@link #stop()} ends it and persists the profile.
 */
public interface Profiler {

    boolean isRunning();

    /**
     * Stops profiling and writes out what was captured.
     *
     * @throws Exception if the profile cannot be stopped or written
     */
    void stop() throws Exception;
}
