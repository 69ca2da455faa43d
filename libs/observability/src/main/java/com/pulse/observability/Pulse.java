package com.pulse.observability;

import com.pulse.observability.config.PulseConfig;
import com.pulse.observability.core.DefaultSubsystemProvider;
import com.pulse.observability.spi.Profiler;
import com.pulse.observability.spi.PulseLogger;
import com.pulse.observability.spi.PulseMetrics;
import com.pulse.observability.spi.PulseTracer;
import com.pulse.observability.spi.Recorder;
import com.pulse.observability.spi.Subsystem;
import com.pulse.observability.spi.SubsystemProvider;
import com.pulse.observability.spi.TelemetryCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Handle owning every telemetry subsystem of a process: logger, metrics, tracer, and optionally a
 * profiler and a recorder, all sharing one telemetry core.
 * <p>
 * Created once by {@link #create}, released once by {@link #shutdown()}. The handle is the sole
 * owner of its collaborators; none of them outlives it.
 * <pre>{@code
 * ServiceIdentity identity = ServiceIdentity.of("planner", Environment.PRODUCTION);
 * try (Pulse pulse = Pulse.create(identity, PulseConfigLoader.loadDefault())) {
 *     pulse.logger().info("planner started");
 *     pulse.metrics().counter("plans.created", "Plans created").increment();
 * }
 * }</pre>
 * Logger, metrics and tracer may be used from many threads. Callers must stop using them before
 * calling {@link #shutdown()}.
 */
public final class Pulse implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Pulse.class);

    private final ServiceIdentity identity;
    private final PulseLogger logger;
    private final PulseMetrics metrics;
    private final PulseTracer tracer;

    private volatile TelemetryCore telemetry;
    private volatile Profiler profiler;
    private volatile Recorder recorder;
    private boolean shutdown;

    private Pulse(ServiceIdentity identity, TelemetryCore telemetry, PulseLogger logger, PulseMetrics metrics,
                  PulseTracer tracer, Profiler profiler, Recorder recorder) {
        this.identity = identity;
        this.telemetry = telemetry;
        this.logger = logger;
        this.metrics = metrics;
        this.tracer = tracer;
        this.profiler = profiler;
        this.recorder = recorder;
    }

    /**
     * Starts every enabled subsystem with the production collaborators.
     *
     * @throws StartupException if any subsystem fails to start
     */
    public static Pulse create(ServiceIdentity identity, PulseConfig config) throws StartupException {
        return create(identity, config, new DefaultSubsystemProvider());
    }

    /**
     * Starts every enabled subsystem, one after another: telemetry core, logger, metrics, tracer,
     * then the profiler and the recorder if their configs enable them.
     * <p>
     * The first failure aborts startup. Collaborators already built by this call are torn down
     * before the {@link StartupException} propagates; teardown failures during that rollback are
     * attached to it as suppressed exceptions.
     *
     * @throws StartupException if any subsystem fails to start
     */
    public static Pulse create(ServiceIdentity identity, PulseConfig config, SubsystemProvider provider)
            throws StartupException {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(provider, "provider must not be null");

        boolean profilingEnabled = config.profiling().enabled();
        boolean recordingEnabled = config.recording().enabled();

        TelemetryCore core = null;
        Profiler profiler = null;
        Subsystem step = Subsystem.TELEMETRY_CORE;
        try {
            core = constructed(step, provider.createTelemetryCore(identity, config.telemetry()));

            step = Subsystem.LOGGER;
            PulseLogger logger = constructed(step, provider.createLogger(identity, core));

            step = Subsystem.METRICS;
            PulseMetrics metrics = constructed(step, provider.createMetrics(identity, core));

            step = Subsystem.TRACER;
            PulseTracer tracer = constructed(step, provider.createTracer(identity, core));

            step = Subsystem.PROFILER;
            if (profilingEnabled) {
                profiler = constructed(step, provider.createProfiler(identity, config.profiling()));
            }

            step = Subsystem.RECORDER;
            Recorder recorder = recordingEnabled
                    ? constructed(step, provider.createRecorder(config.recording()))
                    : null;

            log.info("Pulse started for {} {} ({}), profiler={}, recorder={}",
                    identity.name(), identity.version(), identity.environment(),
                    profiler != null ? "on" : "off", recorder != null ? "on" : "off");
            return new Pulse(identity, core, logger, metrics, tracer, profiler, recorder);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            StartupException failure = new StartupException(step, e);
            log.error("Pulse startup for {} failed at {}", identity.name(), step.displayName(), e);
            rollBack(failure, core, profiler);
            throw failure;
        }
    }

    /**
     * Tears down every subsystem in order: profiler, recorder, then the telemetry core (which
     * flushes whatever the logger, metrics and tracer registered through it).
     * <p>
     * A failing step does not stop the ones after it, even when it throws an {@link Error}. Every
     * failure is logged. If any step threw an {@link Error}, the first such error is rethrown once
     * all steps have run, carrying the other failures as suppressed exceptions; otherwise the first
     * {@link TeardownException} is thrown. Calling this again after it has run is a no-op.
     *
     * @throws TeardownException the first teardown step that failed
     */
    public synchronized void shutdown() throws TeardownException {
        if (shutdown) {
            log.debug("Pulse for {} already shut down", identity.name());
            return;
        }
        shutdown = true;

        List<TeardownException> failures = new ArrayList<>();

        Profiler activeProfiler = profiler;
        if (activeProfiler != null) {
            teardown(Subsystem.PROFILER, activeProfiler::stop, failures);
            profiler = null;
        }

        Recorder activeRecorder = recorder;
        if (activeRecorder != null) {
            teardown(Subsystem.RECORDER, activeRecorder::close, failures);
            recorder = null;
        }

        TelemetryCore activeCore = telemetry;
        if (activeCore != null) {
            teardown(Subsystem.TELEMETRY_CORE, activeCore::shutdown, failures);
            telemetry = null;
        }

        if (failures.isEmpty()) {
            log.info("Pulse for {} shut down", identity.name());
            return;
        }
        for (TeardownException failure : failures) {
            log.error("Pulse shutdown step failed for {}: {}",
                    identity.name(), failure.subsystem().displayName(), failure.getCause());
        }
        rethrowFirstError(failures);
        throw failures.get(0);
    }

    /**
     * Same as {@link #shutdown()}, for try-with-resources.
     */
    @Override
    public void close() throws TeardownException {
        shutdown();
    }

    public ServiceIdentity identity() {
        return identity;
    }

    public PulseLogger logger() {
        return logger;
    }

    public PulseMetrics metrics() {
        return metrics;
    }

    public PulseTracer tracer() {
        return tracer;
    }

    /**
     * Returns the profiler, present only if profiling was enabled at creation and the handle has
     * not been shut down.
     */
    public Optional<Profiler> profiler() {
        return Optional.ofNullable(profiler);
    }

    /**
     * Returns the recorder, present only if recording was enabled at creation and the handle has
     * not been shut down.
     */
    public Optional<Recorder> recorder() {
        return Optional.ofNullable(recorder);
    }

    /**
     * Returns the shared telemetry core.
     *
     * @throws IllegalStateException if the handle has been shut down
     */
    public TelemetryCore telemetry() {
        TelemetryCore core = telemetry;
        if (core == null) {
            throw new IllegalStateException("Pulse for " + identity.name() + " has been shut down");
        }
        return core;
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }

    @FunctionalInterface
    private interface TeardownStep {
        void run() throws Exception;
    }

    private static void teardown(Subsystem subsystem, TeardownStep step, List<TeardownException> failures) {
        try {
            step.run();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            failures.add(new TeardownException(subsystem, e));
        } catch (Error e) {
            failures.add(new TeardownException(subsystem, e));
        }
    }

    /**
     * Throws the first {@link Error} among the failures, with every other failure and any extra
     * exception suppressed on it. Returns normally if no step threw an {@link Error}.
     */
    private static void rethrowFirstError(List<TeardownException> failures, Throwable... alsoSuppressed) {
        Error fatal = null;
        for (TeardownException failure : failures) {
            if (fatal == null && failure.getCause() instanceof Error) {
                fatal = (Error) failure.getCause();
            }
        }
        if (fatal == null) {
            return;
        }
        for (TeardownException failure : failures) {
            if (failure.getCause() != fatal) {
                fatal.addSuppressed(failure);
            }
        }
        for (Throwable extra : alsoSuppressed) {
            fatal.addSuppressed(extra);
        }
        throw fatal;
    }

    private static <T> T constructed(Subsystem subsystem, T collaborator) {
        if (collaborator == null) {
            throw new IllegalStateException("Provider returned no " + subsystem.displayName());
        }
        return collaborator;
    }

    private static void rollBack(StartupException failure, TelemetryCore core, Profiler profiler) {
        List<TeardownException> failures = new ArrayList<>();
        if (profiler != null) {
            teardown(Subsystem.PROFILER, profiler::stop, failures);
        }
        if (core != null) {
            teardown(Subsystem.TELEMETRY_CORE, core::shutdown, failures);
        }
        for (TeardownException teardownFailure : failures) {
            log.warn("Rollback of {} after failed startup also failed",
                    teardownFailure.subsystem().displayName(), teardownFailure.getCause());
            failure.addSuppressed(teardownFailure);
        }
        rethrowFirstError(failures, failure);
    }
}
