package com.pulse.observability;

import java.util.Map;

/**
 * Immutable identity of the service emitting telemetry.
 * <p>
 * Shared by every subsystem: it becomes the OpenTelemetry resource, the service tag on metrics,
 * the logger name and the profiler application name. The name, the environment and every
 * attribute entry are validated; a blank version falls back to {@value #UNKNOWN_VERSION}.
 *
 * @param name        logical name of the service (e.g., "planner"); required
 * @param version     version string; defaults to {@value #UNKNOWN_VERSION}
 * @param environment deployment environment; required
 * @param attributes  extra service-level attributes attached to all telemetry; keys and values
 *                    must not be null
 */
public record ServiceIdentity(
        String name,
        String version,
        Environment environment,
        Map<String, String> attributes
) {

    /** Version reported when none is supplied. */
    public static final String UNKNOWN_VERSION = "unknown";

    /** MDC key for service name. */
    public static final String MDC_SERVICE_NAME = "serviceName";

    /** MDC key for service version. */
    public static final String MDC_SERVICE_VERSION = "serviceVersion";

    /** MDC key for environment. */
    public static final String MDC_ENVIRONMENT = "environment";

    public ServiceIdentity {
        if (name == null || name.isEmpty()) {
            throw new ValidationException("name must not be null or empty");
        }
        if (environment == null) {
            throw new ValidationException("environment must not be null");
        }
        if (version == null || version.isBlank()) {
            version = UNKNOWN_VERSION;
        }
        if (attributes == null) {
            attributes = Map.of();
        } else {
            attributes.forEach((key, value) -> {
                if (key == null || value == null) {
                    throw new ValidationException("attribute %s=%s must not have a null key or value"
                            .formatted(key, value));
                }
            });
            attributes = Map.copyOf(attributes);
        }
    }

    /**
     * Creates an identity with an unknown version and no extra attributes.
     */
    public static ServiceIdentity of(String name, Environment environment) {
        return new ServiceIdentity(name, null, environment, Map.of());
    }

    /**
     * Creates an identity from raw configuration values.
     *
     * @param environment environment wire value, parsed with {@link Environment#fromValue(String)}
     * @throws ValidationException if the name is empty or the environment is unknown
     */
    public static ServiceIdentity of(String name, String version, String environment) {
        return new ServiceIdentity(name, version, Environment.fromValue(environment), Map.of());
    }

    /**
     * Returns a copy with the given attributes.
     *
     * @throws ValidationException if an attribute key or value is null
     */
    public ServiceIdentity withAttributes(Map<String, String> attributes) {
        return new ServiceIdentity(name, version, environment, attributes);
    }
}
