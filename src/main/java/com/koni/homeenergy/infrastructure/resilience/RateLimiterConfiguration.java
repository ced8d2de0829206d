package com.koni.homeenergy.infrastructure.resilience;

import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration for admission control.
 * 
 * One named {@link RateLimiterConfig} per {@link AdmissionTier}:
 * - short: single-record ingestion (default 50 per second)
 * - medium: batch ingestion and queries (default 20 per 10 seconds)
 * - long: administrative operations (default 5 per minute)
 * 
 * Every config uses a zero timeout, so a request over the limit is rejected at once
 * instead of waiting for the next refresh period.
 */
@Slf4j
@Configuration
public class RateLimiterConfiguration {

    @Value("${telemetry.admission.short.limit:50}")
    private int shortLimit;

    @Value("${telemetry.admission.short.period:1s}")
    private Duration shortPeriod;

    @Value("${telemetry.admission.medium.limit:20}")
    private int mediumLimit;

    @Value("${telemetry.admission.medium.period:10s}")
    private Duration mediumPeriod;

    @Value("${telemetry.admission.long.limit:5}")
    private int longLimit;

    @Value("${telemetry.admission.long.period:60s}")
    private Duration longPeriod;

    /**
     * Creates the registry holding the per-tier configurations. Limiters themselves
     * are created lazily per client by {@link AdmissionController}.
     *
     * @return RateLimiterRegistry with one named config per tier
     */
    @Bean
    public RateLimiterRegistry rateLimiterRegistry() {
        log.info("Admission tiers: short={}/{}, medium={}/{}, long={}/{}",
                shortLimit, shortPeriod, mediumLimit, mediumPeriod, longLimit, longPeriod);
        return RateLimiterRegistry.of(Map.of(
                AdmissionTier.SHORT.getConfigName(), tierConfig(shortLimit, shortPeriod),
                AdmissionTier.MEDIUM.getConfigName(), tierConfig(mediumLimit, mediumPeriod),
                AdmissionTier.LONG.getConfigName(), tierConfig(longLimit, longPeriod)));
    }

    static RateLimiterConfig tierConfig(int limit, Duration period) {
        return RateLimiterConfig.custom()
                .limitForPeriod(limit)
                .limitRefreshPeriod(period)
                .timeoutDuration(Duration.ZERO)
                .build();
    }
}
