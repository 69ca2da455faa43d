package com.pulse.observability.spi;

/**
 * The collaborator slots owned by a {@link com.pulse.observability.Pulse} handle, in creation order.
 */
public enum Subsystem {

    TELEMETRY_CORE("telemetry core"),
    LOGGER("logger"),
    METRICS("metrics"),
    TRACER("tracer"),
    PROFILER("profiler"),
    RECORDER("recorder");

    private final String displayName;

    Subsystem(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns a human-readable name for log and exception messages.
     */
    public String displayName() {
        return displayName;
    }
}
