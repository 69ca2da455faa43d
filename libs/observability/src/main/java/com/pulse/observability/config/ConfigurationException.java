package com.pulse.observability.config;

/**
 * Thrown when a configuration file cannot be read or bound.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
