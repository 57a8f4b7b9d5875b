package com.atrium.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for Micrometer meters that always carry a {@code service} tag.
 * <p>
 * Authentication and authorization outcomes are counted through this factory so every
 * Atrium service names and tags them the same way. Tenant and user IDs never become tags.
 */
public final class MetricFactory {

    /** Counter of login/refresh/resolve attempts, tagged by operation and outcome. */
    public static final String AUTH_ATTEMPTS = "atrium.auth.attempts";

    /** Counter of authorization decisions, tagged by action, decision and reason. */
    public static final String AUTHZ_DECISIONS = "atrium.authz.decisions";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
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
     * Returns (creating on first use) a counter with the service tag plus extra key-value tags.
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns (creating on first use) a timer with the service tag plus extra key-value tags.
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /** Increments {@value #AUTH_ATTEMPTS} for the given operation and outcome. */
    public void recordAuthAttempt(String operation, String outcome) {
        counter(AUTH_ATTEMPTS, "Authentication attempts", "operation", operation, "outcome", outcome)
                .increment();
    }

    /** Increments {@value #AUTHZ_DECISIONS} for the given action, decision and reason. */
    public void recordDecision(String action, String decision, String reason) {
        counter(AUTHZ_DECISIONS, "Authorization decisions",
                "action", action, "decision", decision, "reason", reason)
                .increment();
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
}
