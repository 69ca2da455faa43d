package com.pulse.observability.spi;

import org.slf4j.event.Level;

import java.util.Map;

/**
 * Structured logger bound to the service identity.
 * <p>
 * Attributes are emitted as key-value pairs alongside the service's own name, version and
 * environment.
 */
public interface PulseLogger {

    void debug(String message, Map<String, ?> attributes);

    void info(String message, Map<String, ?> attributes);

    void warn(String message, Map<String, ?> attributes);

    void error(String message, Map<String, ?> attributes);

    void error(String message, Throwable cause, Map<String, ?> attributes);

    default void debug(String message) {
        debug(message, Map.of());
    }

    default void info(String message) {
        info(message, Map.of());
    }

    default void warn(String message) {
        warn(message, Map.of());
    }

    default void error(String message) {
        error(message, Map.of());
    }

    /**
     * Returns true if events at the given level reach an appender.
     */
    boolean isEnabled(Level level);
}
