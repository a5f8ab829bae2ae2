package com.warden.security;

import java.time.Duration;

/**
 * Budget for {@link RateLimiter}: at most {@code maxRequests} admissions per {@code window}.
 */
public record RateLimitConfig(int maxRequests, Duration window) {

    /** 3 requests every 20 seconds. */
    public static final RateLimitConfig DEFAULT = new RateLimitConfig(3, Duration.ofSeconds(20));

    public RateLimitConfig {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    public static RateLimitConfig of(int maxRequests, long windowSeconds) {
        return new RateLimitConfig(maxRequests, Duration.ofSeconds(windowSeconds));
    }
}
