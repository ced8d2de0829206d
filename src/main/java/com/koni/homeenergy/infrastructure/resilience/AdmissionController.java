package com.koni.homeenergy.infrastructure.resilience;

import com.koni.homeenergy.domain.exception.RateLimitedException;
import com.koni.homeenergy.infrastructure.observability.TelemetryMetrics;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tiered, per-client admission control.
 *
 * Each (tier, client) pair gets its own limiter from the tier's config, so tiers
 * reset independently and one noisy client cannot use up another client's budget.
 * Counters live in this process only.
 *
 * Lookup and idle eviction of a limiter run atomically per key, so a limiter is
 * never removed from the registry while a request is using it.
 */
@Slf4j
@Component
public class AdmissionController {

    private final RateLimiterRegistry registry;
    private final TelemetryMetrics telemetryMetrics;
    private final Clock clock;
    private final Duration idleEviction;
    private final Map<String, TrackedLimiter> limiters = new ConcurrentHashMap<>();

    public AdmissionController(
            RateLimiterRegistry registry,
            TelemetryMetrics telemetryMetrics,
            Clock clock,
            @Value("${telemetry.admission.idle-eviction:10m}") Duration idleEviction) {
        this.registry = registry;
        this.telemetryMetrics = telemetryMetrics;
        this.clock = clock;
        this.idleEviction = idleEviction;
    }

    /**
     * Takes one permit for the client in the given tier.
     *
     * @throws RateLimitedException if the client has used up the tier's limit for the current period
     */
    public void admit(AdmissionTier tier, String clientKey) {
        TrackedLimiter tracked = limiters.compute(limiterName(tier, clientKey), (name, existing) -> {
            TrackedLimiter current = existing != null
                    ? existing
                    : new TrackedLimiter(registry.rateLimiter(name, tier.getConfigName()));
            current.lastSeen = clock.instant();
            return current;
        });

        RateLimiter limiter = tracked.limiter;
        if (!limiter.acquirePermission()) {
            telemetryMetrics.recordAdmissionRejected(tier.getConfigName());
            Duration retryAfter = limiter.getRateLimiterConfig().getLimitRefreshPeriod();
            log.warn("Rate limit exceeded: tier={}, client={}", tier.getConfigName(), clientKey);
            throw new RateLimitedException(tier.getConfigName(), retryAfter);
        }
    }

    /**
     * Drops limiters that have not been used for the idle-eviction period.
     */
    @Scheduled(fixedDelayString = "${telemetry.admission.eviction-interval-ms:60000}")
    public void evictIdle() {
        Instant threshold = clock.instant().minus(idleEviction);
        AtomicInteger evicted = new AtomicInteger();
        for (String name : limiters.keySet()) {
            limiters.computeIfPresent(name, (key, tracked) -> {
                if (!tracked.lastSeen.isBefore(threshold)) {
                    return tracked;
                }
                registry.remove(key);
                evicted.incrementAndGet();
                return null;
            });
        }
        if (evicted.get() > 0) {
            log.debug("Evicted {} idle rate limiters", evicted.get());
        }
    }

    int trackedLimiters() {
        return limiters.size();
    }

    Set<String> trackedNames() {
        return Set.copyOf(limiters.keySet());
    }

    private static String limiterName(AdmissionTier tier, String clientKey) {
        return tier.getConfigName() + ":" + clientKey;
    }

    private static final class TrackedLimiter {
        private final RateLimiter limiter;
        private volatile Instant lastSeen;

        private TrackedLimiter(RateLimiter limiter) {
            this.limiter = limiter;
        }
    }
}
