package com.pulse.observability.spi;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates meters tagged with the owning service.
 * <p>
 * Tags are passed as alternating key-value pairs. Asking twice for the same name and tags
 * returns the same meter.
 */
public interface PulseMetrics {

    /**
     * Returns or registers a monotonically increasing counter.
     *
     * @param name        meter name (e.g., "plans.created")
     * @param description what the counter counts
     * @param tags        extra tags as alternating key-value pairs
     * @return the counter
     */
    Counter counter(String name, String description, String... tags);

    /**
     * Returns or registers a timer of durations.
     *
     * @param name        meter name (e.g., "plan.duration")
     * @param description what the timer measures
     * @param tags        extra tags as alternating key-value pairs
     * @return the timer
     */
    Timer timer(String name, String description, String... tags);

    /**
     * Returns or registers a distribution summary of arbitrary amounts.
     *
     * @param name        meter name (e.g., "scan.points")
     * @param description what the recorded amounts are
     * @param tags        extra tags as alternating key-value pairs
     * @return the distribution summary
     */
    DistributionSummary distributionSummary(String name, String description, String... tags);

    /**
     * Registers a gauge and returns the value holder backing it.
     *
     * @param name        meter name (e.g., "queue.depth")
     * @param description what the gauge reports
     * @param tags        extra tags as alternating key-value pairs
     * @return the holder whose current value the gauge reports
     */
    AtomicLong gauge(String name, String description, String... tags);

    /**
     * Returns the registry meters are added to, for meter types not covered here.
     *
     * @return the underlying meter registry
     */
    MeterRegistry registry();
}
