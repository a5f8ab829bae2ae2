package com.warden.security;

import java.time.Duration;

/**
 * Outcome of one {@link RateLimiter#admit(String)} call.
 *
 * @param allowed    whether the request is within budget
 * @param remaining  admissions left in the current window (0 when rejected)
 * @param retryAfter time until the current window ends; zero when allowed
 */
public record RateLimitResult(boolean allowed, int remaining, Duration retryAfter) {

    public static RateLimitResult allowed(int remaining) {
        return new RateLimitResult(true, remaining, Duration.ZERO);
    }

    public static RateLimitResult rejected(Duration retryAfter) {
        return new RateLimitResult(false, 0, retryAfter);
    }
}
