package com.pulse.observability.core;

import com.pulse.observability.ServiceIdentity;
import com.pulse.observability.spi.PulseLogger;
import com.pulse.observability.spi.TelemetryCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.helpers.NOPLogger;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Map;

/**
 * {@link PulseLogger} on top of the SLF4J fluent API.
 * <p>
 * The SLF4J logger is named after the service. Every event carries the service name, version
 * and environment as key-value pairs, so any key-value aware encoder (Logback, Log4j 2, the
 * OpenTelemetry appenders) can ship them with the message. Events below the environment's
 * default level are dropped before they reach SLF4J.
 */
public final class Slf4jPulseLogger implements PulseLogger {

    public static final String KEY_SERVICE_NAME = "service.name";
    public static final String KEY_SERVICE_VERSION = "service.version";
    public static final String KEY_ENVIRONMENT = "environment";

    private final ServiceIdentity identity;
    private final Logger delegate;
    private final Level minimumLevel;

    /**
     * Creates a logger for the service; a no-op logger when the core has logging disabled.
     */
    public Slf4jPulseLogger(ServiceIdentity identity, TelemetryCore core) {
        this(identity,
                core.config().loggingEnabled() ? LoggerFactory.getLogger(identity.name()) : NOPLogger.NOP_LOGGER,
                identity.environment().defaultLogLevel());
    }

    /**
     * Creates a logger writing to an explicit SLF4J logger with an explicit threshold.
     */
    public Slf4jPulseLogger(ServiceIdentity identity, Logger delegate, Level minimumLevel) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (minimumLevel == null) {
            throw new IllegalArgumentException("minimumLevel must not be null");
        }
        this.identity = identity;
        this.delegate = delegate;
        this.minimumLevel = minimumLevel;
    }

    @Override
    public void debug(String message, Map<String, ?> attributes) {
        log(Level.DEBUG, message, null, attributes);
    }

    @Override
    public void info(String message, Map<String, ?> attributes) {
        log(Level.INFO, message, null, attributes);
    }

    @Override
    public void warn(String message, Map<String, ?> attributes) {
        log(Level.WARN, message, null, attributes);
    }

    @Override
    public void error(String message, Map<String, ?> attributes) {
        log(Level.ERROR, message, null, attributes);
    }

    @Override
    public void error(String message, Throwable cause, Map<String, ?> attributes) {
        log(Level.ERROR, message, cause, attributes);
    }

    @Override
    public boolean isEnabled(Level level) {
        return level.toInt() >= minimumLevel.toInt() && delegate.isEnabledForLevel(level);
    }

    /**
     * Returns the threshold below which events are dropped.
     */
    public Level minimumLevel() {
        return minimumLevel;
    }

    /**
     * Returns the SLF4J logger events are written to.
     */
    public Logger delegate() {
        return delegate;
    }

    private void log(Level level, String message, Throwable cause, Map<String, ?> attributes) {
        if (!isEnabled(level)) {
            return;
        }
        LoggingEventBuilder event = delegate.atLevel(level)
                .addKeyValue(KEY_SERVICE_NAME, identity.name())
                .addKeyValue(KEY_SERVICE_VERSION, identity.version())
                .addKeyValue(KEY_ENVIRONMENT, identity.environment().value());
        if (attributes != null) {
            attributes.forEach((key, value) -> event.addKeyValue(key, value));
        }
        if (cause != null) {
            event.setCause(cause);
        }
        event.log(message);
    }
}
