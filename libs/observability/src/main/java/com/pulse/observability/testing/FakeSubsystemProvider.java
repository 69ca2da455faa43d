package com.pulse.observability.testing;

import com.pulse.observability.ServiceIdentity;
import com.pulse.observability.config.ProfilingConfig;
import com.pulse.observability.config.RecordingConfig;
import com.pulse.observability.config.TelemetryConfig;
import com.pulse.observability.core.MicrometerMetrics;
import com.pulse.observability.core.OpenTelemetryTracer;
import com.pulse.observability.core.Slf4jPulseLogger;
import com.pulse.observability.spi.Profiler;
import com.pulse.observability.spi.PulseLogger;
import com.pulse.observability.spi.PulseMetrics;
import com.pulse.observability.spi.PulseTracer;
import com.pulse.observability.spi.Recorder;
import com.pulse.observability.spi.Subsystem;
import com.pulse.observability.spi.SubsystemProvider;
import com.pulse.observability.spi.TelemetryCore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A controllable {@link SubsystemProvider} for testing lifecycle logic.
 * <p>
 * Every construction and teardown is appended to a shared call journal as
 * {@code "create:<SUBSYSTEM>"} or {@code "teardown:<SUBSYSTEM>"}, and any subsystem can be told to
 * fail either step. The telemetry core is a {@link FakeTelemetryCore}; logger, metrics and tracer
 * are the real implementations bound to it. Placed in {@code src/main/java} for cross-module test use.
 */
public final class FakeSubsystemProvider implements SubsystemProvider {

    public static final String CREATE = "create:";
    public static final String TEARDOWN = "teardown:";

    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Set<Subsystem> failOnCreate = EnumSet.noneOf(Subsystem.class);
    private final Set<Subsystem> failOnTeardown = EnumSet.noneOf(Subsystem.class);
    private final Set<Subsystem> crashOnTeardown = EnumSet.noneOf(Subsystem.class);

    private FakeTelemetryCore core;
    private FakeProfiler profiler;
    private FakeRecorder recorder;

    /**
     * Makes construction of the given subsystem throw {@link SimulatedFailure}.
     */
    public FakeSubsystemProvider failOnCreate(Subsystem subsystem) {
        failOnCreate.add(subsystem);
        return this;
    }

    /**
     * Makes teardown of the given subsystem throw {@link SimulatedFailure}. Only the profiler,
     * recorder and telemetry core have a teardown step.
     */
    public FakeSubsystemProvider failOnTeardown(Subsystem subsystem) {
        failOnTeardown.add(subsystem);
        return this;
    }

    /**
     * Makes teardown of the given subsystem throw {@link SimulatedCrash}, an {@link Error}.
     */
    public FakeSubsystemProvider crashOnTeardown(Subsystem subsystem) {
        crashOnTeardown.add(subsystem);
        return this;
    }

    @Override
    public TelemetryCore createTelemetryCore(ServiceIdentity identity, TelemetryConfig config) {
        create(Subsystem.TELEMETRY_CORE);
        core = new FakeTelemetryCore(identity, config, teardownAction(Subsystem.TELEMETRY_CORE));
        return core;
    }

    @Override
    public PulseLogger createLogger(ServiceIdentity identity, TelemetryCore core) {
        create(Subsystem.LOGGER);
        return new Slf4jPulseLogger(identity, core);
    }

    @Override
    public PulseMetrics createMetrics(ServiceIdentity identity, TelemetryCore core) {
        create(Subsystem.METRICS);
        return new MicrometerMetrics(identity, core);
    }

    @Override
    public PulseTracer createTracer(ServiceIdentity identity, TelemetryCore core) {
        create(Subsystem.TRACER);
        return new OpenTelemetryTracer(identity, core);
    }

    @Override
    public Profiler createProfiler(ServiceIdentity identity, ProfilingConfig config) {
        create(Subsystem.PROFILER);
        profiler = new FakeProfiler(teardownAction(Subsystem.PROFILER));
        return profiler;
    }

    @Override
    public Recorder createRecorder(RecordingConfig config) {
        create(Subsystem.RECORDER);
        recorder = new FakeRecorder(teardownAction(Subsystem.RECORDER));
        return recorder;
    }

    /**
     * Returns every call marker in the order it happened.
     */
    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    /**
     * Returns only the teardown markers, in order.
     */
    public List<String> teardownCalls() {
        return calls().stream().filter(call -> call.startsWith(TEARDOWN)).toList();
    }

    /**
     * Returns only the construction markers, in order.
     */
    public List<String> createCalls() {
        return calls().stream().filter(call -> call.startsWith(CREATE)).toList();
    }

    /** The last telemetry core built, or null. */
    public FakeTelemetryCore core() {
        return core;
    }

    /** The last profiler built, or null. */
    public FakeProfiler profiler() {
        return profiler;
    }

    /** The last recorder built, or null. */
    public FakeRecorder recorder() {
        return recorder;
    }

    private void create(Subsystem subsystem) {
        calls.add(CREATE + subsystem.name());
        if (failOnCreate.contains(subsystem)) {
            throw new SimulatedFailure("Simulated " + subsystem.displayName() + " startup failure");
        }
    }

    private Runnable teardownAction(Subsystem subsystem) {
        return () -> {
            calls.add(TEARDOWN + subsystem.name());
            if (crashOnTeardown.contains(subsystem)) {
                throw new SimulatedCrash("Simulated " + subsystem.displayName() + " teardown crash");
            }
            if (failOnTeardown.contains(subsystem)) {
                throw new SimulatedFailure("Simulated " + subsystem.displayName() + " teardown failure");
            }
        };
    }

    /**
     * Failure thrown by fakes told to fail.
     */
    public static class SimulatedFailure extends RuntimeException {
        public SimulatedFailure(String message) {
            super(message);
        }
    }

    /**
     * Error thrown by fakes told to crash.
     */
    public static class SimulatedCrash extends Error {
        public SimulatedCrash(String message) {
            super(message);
        }
    }
}
