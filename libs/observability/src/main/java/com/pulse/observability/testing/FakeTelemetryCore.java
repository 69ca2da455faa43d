package com.pulse.observability.testing;

import com.pulse.observability.ServiceIdentity;
import com.pulse.observability.config.TelemetryConfig;
import com.pulse.observability.spi.TelemetryCore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process {@link TelemetryCore}: a no-op OpenTelemetry and a {@link SimpleMeterRegistry}.
 */
public final class FakeTelemetryCore implements TelemetryCore {

    private final ServiceIdentity identity;
    private final TelemetryConfig config;
    private final MeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final Runnable onShutdown;
    private final AtomicInteger shutdownCount = new AtomicInteger();

    public FakeTelemetryCore(ServiceIdentity identity, TelemetryConfig config, Runnable onShutdown) {
        this.identity = identity;
        this.config = config;
        this.onShutdown = onShutdown;
    }

    @Override
    public ServiceIdentity identity() {
        return identity;
    }

    @Override
    public TelemetryConfig config() {
        return config;
    }

    @Override
    public OpenTelemetry openTelemetry() {
        return OpenTelemetry.noop();
    }

    @Override
    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    @Override
    public void shutdown() {
        shutdownCount.incrementAndGet();
        onShutdown.run();
        meterRegistry.close();
    }

    /**
     * Returns how many times {@link #shutdown()} was called.
     */
    public int shutdownCount() {
        return shutdownCount.get();
    }
}
