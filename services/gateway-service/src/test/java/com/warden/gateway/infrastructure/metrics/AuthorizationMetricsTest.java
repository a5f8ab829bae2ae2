package com.warden.gateway.infrastructure.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.observability.MetricFactory;
import com.warden.security.AccessRequest;
import com.warden.security.AuthorizationDecision;
import com.warden.security.RateLimitConfig;
import com.warden.security.RateLimiter;
import com.warden.security.testing.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuthorizationMetrics")
class AuthorizationMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final RateLimiter rateLimiter =
            new RateLimiter(RateLimitConfig.DEFAULT, MutableClock.startingAt("2026-01-01T00:00:00Z"));
    private final AuthorizationMetrics metrics =
            new AuthorizationMetrics(new MetricFactory(registry, "warden-gateway"), rateLimiter);

    private double decisions(String outcome) {
        return registry.get(AuthorizationMetrics.DECISIONS).tag("outcome", outcome).counter().count();
    }

    @Test
    @DisplayName("counts decisions by outcome")
    void countsByOutcome() {
        var request = new AccessRequest("/x", "203.0.113.7", null, null);

        metrics.onDecision(request, AuthorizationDecision.allow(null));
        metrics.onDecision(request, AuthorizationDecision.allow(null));
        metrics.onDecision(request, AuthorizationDecision.rateExceeded(Duration.ofSeconds(3)));
        metrics.onDecision(request, AuthorizationDecision.insufficientPrivilege());

        assertThat(decisions("ALLOW")).isEqualTo(2.0);
        assertThat(decisions("RATE_EXCEEDED")).isEqualTo(1.0);
        assertThat(decisions("INVALID_CREDENTIALS")).isZero();
        assertThat(decisions("INSUFFICIENT_PRIVILEGE")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("reports how many clients the rate limiter tracks")
    void trackedClients() {
        rateLimiter.admit("addr:a");
        rateLimiter.admit("addr:b");

        assertThat(registry.get(AuthorizationMetrics.TRACKED_CLIENTS).gauge().value()).isEqualTo(2.0);
    }
}
