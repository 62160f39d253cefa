package com.smartcampus.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for Micrometer meters carrying the Smart Campus standard tags.
 * <p>
 * Every meter gets a {@code service} tag. Meters created through the {@code forCurrentTenant}
 * variants also get a {@code tenant} tag read from {@link RequestContextHolder}; outside a
 * request, or for callers without a school (super administrators), the tag value is
 * {@value #NO_TENANT}.
 */
public final class MetricFactory {

    /** Tag key for tenant segmentation. */
    public static final String TAG_TENANT = "tenant";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tenant tag value used when no school is bound to the current thread. */
    public static final String NO_TENANT = "none";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer registry (Prometheus in the service, simple in tests)
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
     * Returns (registering on first use) a counter tagged with the service name.
     *
     * @param tags additional tags as key-value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns a counter tagged with the service name and the current request's tenant.
     */
    public Counter counterForCurrentTenant(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags).and(TAG_TENANT, currentTenant()))
                .register(registry);
    }

    /**
     * Returns (registering on first use) a timer tagged with the service name.
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

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

    private static String currentTenant() {
        return RequestContextHolder.get()
                .map(RequestContext::tenantId)
                .orElse(NO_TENANT);
    }
}
