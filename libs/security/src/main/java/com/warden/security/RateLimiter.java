package com.warden.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request counter keyed by client.
 * <p>
 * Each {@link #admit(String)} is a single {@link ConcurrentHashMap#compute} on the client's
 * entry: expire-or-increment happens under the map's per-key lock, so concurrent calls for one
 * key are serialized and never admit past the limit. Keys are independent. Rejected calls are
 * counted too; a request is charged when it is attempted.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimitConfig config;
    private final Clock clock;
    private final Map<String, RateBudget> budgets = new ConcurrentHashMap<>();

    public RateLimiter(RateLimitConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        log.info("RateLimiter initialized with maxRequests={}, window={}", config.maxRequests(), config.window());
    }

    /**
     * Charges one request to {@code clientKey}.
     */
    public RateLimitResult admit(String clientKey) {
        Objects.requireNonNull(clientKey, "clientKey");
        Instant now = clock.instant();
        RateBudget budget = budgets.compute(clientKey, (key, current) ->
                current == null || current.hasExpired(now, config.window())
                        ? new RateBudget(now, 1)
                        : current.increment());

        if (budget.count() <= config.maxRequests()) {
            return RateLimitResult.allowed(config.maxRequests() - budget.count());
        }
        Duration retryAfter = Duration.between(now, budget.windowStart().plus(config.window()));
        log.debug("Rate limit exceeded for client {} (count={}, limit={})", clientKey, budget.count(), config.maxRequests());
        return RateLimitResult.rejected(retryAfter.isNegative() ? Duration.ZERO : retryAfter);
    }

    /**
     * Drops budgets whose window has elapsed. Absent keys behave exactly like expired ones, so
     * this only reclaims memory.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = budgets.size();
        budgets.entrySet().removeIf(entry -> entry.getValue().hasExpired(now, config.window()));
        int removed = before - budgets.size();
        if (removed > 0) {
            log.debug("Purged {} expired rate budget(s)", removed);
        }
        return Math.max(removed, 0);
    }

    public RateLimitConfig config() {
        return config;
    }

    public int trackedClients() {
        return budgets.size();
    }

    /**
     * Per-client window state. Immutable; replaced on every admit.
     */
    record RateBudget(Instant windowStart, int count) {

        boolean hasExpired(Instant now, Duration window) {
            return !now.isBefore(windowStart.plus(window));
        }

        RateBudget increment() {
            return new RateBudget(windowStart, count == Integer.MAX_VALUE ? count : count + 1);
        }
    }
}
