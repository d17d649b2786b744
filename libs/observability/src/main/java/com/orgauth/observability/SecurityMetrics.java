package com.orgauth.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;

/**
 * Micrometer counters for security events.
 *
 * <p>One counter, {@value #EVENTS_METRIC}, tagged by service, event type and reason. Reasons are
 * taken from a closed set of error codes. Tenant and user ids are never used as tags.
 */
public final class SecurityMetrics {

    public static final String EVENTS_METRIC = "orgauth.security.events";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_TYPE = "type";
    public static final String TAG_REASON = "reason";

    static final String NO_REASON = "none";

    private final MeterRegistry registry;
    private final String serviceName;

    public SecurityMetrics(MeterRegistry registry, String serviceName) {
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
     * Counts one occurrence of an event.
     *
     * @param eventType event type name, e.g. {@code LOGIN_FAILED}
     * @param reason error code name, or null for success events
     */
    public void increment(String eventType, String reason) {
        counter(eventType, reason).increment();
    }

    public Counter counter(String eventType, String reason) {
        return Counter.builder(EVENTS_METRIC)
                .description("Security events by type and reason")
                .tags(Tags.of(
                        TAG_SERVICE, serviceName,
                        TAG_TYPE, tagValue(eventType),
                        TAG_REASON, reason == null ? NO_REASON : tagValue(reason)))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    private static String tagValue(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
