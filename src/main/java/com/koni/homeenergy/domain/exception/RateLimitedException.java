package com.koni.homeenergy.domain.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Exception thrown when admission control rejects a request.
 * The caller is expected to back off for at least {@link #getRetryAfter()}.
 */
@Getter
public class RateLimitedException extends RuntimeException {

    private final String tier;
    private final Duration retryAfter;

    public RateLimitedException(String tier, Duration retryAfter) {
        super("Rate limit exceeded for tier '" + tier + "'");
        this.tier = tier;
        this.retryAfter = retryAfter;
    }
}
