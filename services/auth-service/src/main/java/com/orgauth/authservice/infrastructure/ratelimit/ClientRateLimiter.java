package com.orgauth.authservice.infrastructure.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;

/**
 * Fixed-window request allowance per client key.
 *
 * <p>Each key gets its own resilience4j {@link RateLimiter} that never waits for a permit. The
 * limiters live in a Caffeine cache bounded by {@code maxTrackedClients}; an idle key is dropped
 * once a full period has passed without requests, when its allowance would have refilled anyway.
 */
public class ClientRateLimiter {

    private final String name;
    private final RateLimiterConfig config;
    private final Cache<String, RateLimiter> limiters;

    public ClientRateLimiter(String name, int requestsPerPeriod, Duration period, long maxTrackedClients) {
        this.name = name;
        this.config = RateLimiterConfig.custom()
                .limitRefreshPeriod(period)
                .limitForPeriod(requestsPerPeriod)
                .timeoutDuration(Duration.ZERO)
                .build();
        this.limiters = Caffeine.newBuilder()
                .expireAfterAccess(period)
                .maximumSize(maxTrackedClients)
                .build();
    }

    /** Consumes one permit for {@code clientKey}; false when its allowance for the period is used up. */
    public boolean tryAcquire(String clientKey) {
        return limiters.get(clientKey, key -> RateLimiter.of(name + "-" + key, config)).acquirePermission();
    }

    /** Seconds until a rejected client may retry, rounded up. */
    public long retryAfterSeconds() {
        Duration period = config.getLimitRefreshPeriod();
        return Math.max(1, (period.toMillis() + 999) / 1000);
    }
}
