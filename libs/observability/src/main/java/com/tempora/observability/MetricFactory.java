package com.tempora.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for Micrometer meters that carry a {@code service} tag and, where the meter is
 * tenant-segmented, an explicit {@code tenant} tag.
 *
 * <p>Tenant is always passed in by the caller; the factory never reads it from thread-local state.
 * Micrometer de-duplicates meters by name and tags, so asking for the same meter twice returns the
 * registered instance.
 */
public final class MetricFactory {

    /** Tag key for tenant segmentation. */
    public static final String TAG_TENANT = "tenant";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns a counter with the service tag and any additional key-value tags.
     *
     * @param name metric name (e.g. "tempora.audit.failures")
     * @param description human-readable description
     * @param tags additional tags as alternating keys and values
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /** Returns a counter segmented by tenant. */
    public Counter tenantCounter(String name, String description, String tenantId, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags).and(TAG_TENANT, tenantId))
                .register(registry);
    }

    /** Returns a timer with the service tag and any additional tags. */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /** Returns a distribution summary with the service tag, recording values in {@code baseUnit}. */
    public DistributionSummary distributionSummary(
            String name, String description, String baseUnit, String... tags) {
        return DistributionSummary.builder(name)
                .description(description)
                .baseUnit(baseUnit)
                .tags(baseTags(tags))
                .register(registry);
    }

    /** Returns the underlying meter registry. */
    public MeterRegistry registry() {
        return registry;
    }

    /** Returns the service name used as a default tag. */
    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
