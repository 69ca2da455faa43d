package com.pulse.observability;

import org.slf4j.event.Level;

import java.util.Locale;

/**
 * Deployment environment a service runs in.
 * <p>
 * Each environment carries its lowercase wire value (as written in configuration files and
 * telemetry resource attributes) and the minimum log level applied when no other level is set.
 */
public enum Environment {

    DEVELOPMENT("development", Level.DEBUG),
    STAGING("staging", Level.WARN),
    PRODUCTION("production", Level.INFO),
    /** Embedded and edge devices (robots, single-board computers). */
    EMBEDDED("embedded", Level.DEBUG);

    private final String value;
    private final Level defaultLogLevel;

    Environment(String value, Level defaultLogLevel) {
        this.value = value;
        this.defaultLogLevel = defaultLogLevel;
    }

    /**
     * Returns the wire value (e.g., "production").
     */
    public String value() {
        return value;
    }

    /**
     * Returns the minimum log level used by default in this environment.
     */
    public Level defaultLogLevel() {
        return defaultLogLevel;
    }

    /**
     * Parses an environment from its wire value, ignoring case.
     *
     * @param value the wire value (e.g., "staging")
     * @return the matching environment
     * @throws ValidationException if the value is null, blank, or not a known environment
     */
    public static Environment fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("environment must not be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Environment environment : values()) {
            if (environment.value.equals(normalized)) {
                return environment;
            }
        }
        throw new ValidationException("Unknown environment '%s'".formatted(value));
    }

    @Override
    public String toString() {
        return value;
    }
}
