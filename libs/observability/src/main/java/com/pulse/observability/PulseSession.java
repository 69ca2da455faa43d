package com.pulse.observability;

import com.pulse.observability.config.PulseConfig;
import com.pulse.observability.core.DefaultSubsystemProvider;
import com.pulse.observability.spi.SubsystemProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs a unit of work with a {@link Pulse} handle that is shut down on every exit path.
 * <pre>{@code
 * int processed = PulseSession.withSession(identity, config, pulse -> {
 *     pulse.logger().info("batch started");
 *     return processBatch(pulse);
 * });
 * }</pre>
 * The scope's own result or exception always reaches the caller unchanged. A shutdown failure is
 * logged; if the scope threw, it is also attached to the scope's exception as suppressed.
 * <p>
 * While the scope runs, the calling thread's SLF4J MDC carries the service name, version and
 * environment under the {@link ServiceIdentity} MDC keys. The previous values are restored once
 * the scope exits.
 */
public final class PulseSession {

    private static final Logger log = LoggerFactory.getLogger(PulseSession.class);

    private PulseSession() {
        // utility class
    }

    /**
     * Runs the scope with the production collaborators.
     *
     * @throws StartupException if the handle cannot be created; the scope does not run
     */
    public static <T, E extends Exception> T withSession(ServiceIdentity identity, PulseConfig config,
                                                         PulseScope<T, E> scope) throws StartupException, E {
        return withSession(identity, config, new DefaultSubsystemProvider(), scope);
    }

    /**
     * Creates a handle, runs the scope with it, and shuts the handle down exactly once.
     *
     * @throws StartupException if the handle cannot be created; the scope does not run
     */
    public static <T, E extends Exception> T withSession(ServiceIdentity identity, PulseConfig config,
                                                         SubsystemProvider provider,
                                                         PulseScope<T, E> scope) throws StartupException, E {
        if (scope == null) {
            throw new IllegalArgumentException("scope must not be null");
        }
        Pulse pulse = Pulse.create(identity, config, provider);
        Map<String, String> previousMdc = putIdentity(pulse.identity());
        Throwable scopeFailure = null;
        try {
            return scope.run(pulse);
        } catch (Throwable t) {
            scopeFailure = t;
            throw t;
        } finally {
            previousMdc.forEach(PulseSession::restoreMdc);
            shutdown(pulse, scopeFailure);
        }
    }

    /**
     * Publishes the identity in the MDC and returns the values it replaced, null where a key was unset.
     */
    private static Map<String, String> putIdentity(ServiceIdentity identity) {
        Map<String, String> values = Map.of(
                ServiceIdentity.MDC_SERVICE_NAME, identity.name(),
                ServiceIdentity.MDC_SERVICE_VERSION, identity.version(),
                ServiceIdentity.MDC_ENVIRONMENT, identity.environment().value());
        Map<String, String> previous = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            previous.put(key, MDC.get(key));
            MDC.put(key, value);
        });
        return previous;
    }

    private static void restoreMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void shutdown(Pulse pulse, Throwable scopeFailure) {
        try {
            pulse.shutdown();
        } catch (TeardownException e) {
            if (scopeFailure != null) {
                log.error("Pulse shutdown for {} failed after the session scope failed",
                        pulse.identity().name(), e);
                scopeFailure.addSuppressed(e);
            } else {
                log.error("Pulse shutdown for {} failed after the session scope completed",
                        pulse.identity().name(), e);
            }
        }
    }
}
