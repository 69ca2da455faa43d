package com.pulse.observability.core;

import com.pulse.observability.ServiceIdentity;
import com.pulse.observability.spi.PulseMetrics;
import com.pulse.observability.spi.TelemetryCore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link PulseMetrics} that registers Micrometer meters on the telemetry core's registry.
 * <p>
 * Every meter is tagged from the {@link ServiceIdentity}: {@value #TAG_SERVICE},
 * {@value #TAG_VERSION}, and one tag per identity attribute. The core's registry adds the
 * {@code environment} tag on top. Tags passed per meter override identity tags of the same key.
 * When the core has metrics disabled its registry has no backing store and the meters are no-ops.
 * <p>
 * Meters are registered once per name and tag set; asking again returns the meter (or, for
 * gauges, the value holder) registered first.
 */
public final class MicrometerMetrics implements PulseMetrics {

    /** Tag key for the service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for the service version. */
    public static final String TAG_VERSION = "version";

    private final MeterRegistry registry;
    private final ServiceIdentity identity;
    private final Tags identityTags;
    private final ConcurrentMap<GaugeKey, AtomicLong> gauges = new ConcurrentHashMap<>();

    private record GaugeKey(String name, Tags tags) {
    }

    /**
     * Creates metrics on the core's shared registry.
     *
     * @param identity the service whose identity tags every meter
     * @param core     the telemetry core owning the registry
     */
    public MicrometerMetrics(ServiceIdentity identity, TelemetryCore core) {
        this(core.meterRegistry(), identity);
    }

    /**
     * Creates metrics on an arbitrary registry.
     *
     * @param registry the registry meters are added to
     * @param identity the service whose identity tags every meter
     * @throws IllegalArgumentException if either argument is null
     */
    public MicrometerMetrics(MeterRegistry registry, ServiceIdentity identity) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        this.registry = registry;
        this.identity = identity;
        this.identityTags = identityTags(identity);
    }

    /**
     * Returns or registers a counter.
     *
     * @param name        meter name (e.g., "plans.created")
     * @param description what the counter counts
     * @param tags        extra tags as alternating key-value pairs
     * @return the counter for this name and tag set
     * @throws IllegalArgumentException if {@code tags} has an odd length
     */
    @Override
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(meterTags(tags))
                .register(registry);
    }

    /**
     * Returns or registers a timer.
     *
     * @param name        meter name (e.g., "plan.duration")
     * @param description what the timer measures
     * @param tags        extra tags as alternating key-value pairs
     * @return the timer for this name and tag set
     * @throws IllegalArgumentException if {@code tags} has an odd length
     */
    @Override
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(meterTags(tags))
                .register(registry);
    }

    /**
     * Returns or registers a distribution summary.
     *
     * @param name        meter name (e.g., "scan.points")
     * @param description what the recorded amounts are
     * @param tags        extra tags as alternating key-value pairs
     * @return the summary for this name and tag set
     * @throws IllegalArgumentException if {@code tags} has an odd length
     */
    @Override
    public DistributionSummary distributionSummary(String name, String description, String... tags) {
        return DistributionSummary.builder(name)
                .description(description)
                .tags(meterTags(tags))
                .register(registry);
    }

    /**
     * Returns the value holder of a gauge, registering the gauge on first use. The holder is
     * strongly referenced by the gauge, so it reports until the registry is closed.
     *
     * @param name        meter name (e.g., "queue.depth")
     * @param description what the gauge reports
     * @param tags        extra tags as alternating key-value pairs
     * @return the holder whose value the gauge reports; the same holder on every call with this
     *         name and tag set
     * @throws IllegalArgumentException if {@code tags} has an odd length
     */
    @Override
    public AtomicLong gauge(String name, String description, String... tags) {
        Tags meterTags = meterTags(tags);
        return gauges.computeIfAbsent(new GaugeKey(name, meterTags), key -> {
            AtomicLong value = new AtomicLong();
            Gauge.builder(name, value, AtomicLong::doubleValue)
                    .description(description)
                    .tags(meterTags)
                    .strongReference(true)
                    .register(registry);
            return value;
        });
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the identity whose tags every meter carries.
     */
    public ServiceIdentity identity() {
        return identity;
    }

    /**
     * Returns the tags added to every meter before per-meter tags.
     */
    public Tags identityTags() {
        return identityTags;
    }

    private Tags meterTags(String... extraTags) {
        return extraTags.length == 0 ? identityTags : identityTags.and(extraTags);
    }

    private static Tags identityTags(ServiceIdentity identity) {
        Tags tags = Tags.empty();
        for (Map.Entry<String, String> attribute : identity.attributes().entrySet()) {
            tags = tags.and(Tag.of(attribute.getKey(), attribute.getValue()));
        }
        return tags.and(TAG_SERVICE, identity.name()).and(TAG_VERSION, identity.version());
    }
}
