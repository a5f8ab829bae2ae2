package com.warden.gateway.infrastructure.metrics;

import com.warden.observability.MetricFactory;
import com.warden.security.AccessRequest;
import com.warden.security.AuthorizationDecision;
import com.warden.security.AuthorizationDecision.Outcome;
import com.warden.security.AuthorizationListener;
import com.warden.security.RateLimiter;
import io.micrometer.core.instrument.Counter;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Counts mediation decisions by outcome and exposes the size of the rate-limit budget table.
 *
 * <p>Meters: {@code warden.authorization.decisions{outcome}} and {@code
 * warden.ratelimit.tracked.clients}.
 */
@Component
public class AuthorizationMetrics implements AuthorizationListener {

    public static final String DECISIONS = "warden.authorization.decisions";
    public static final String TRACKED_CLIENTS = "warden.ratelimit.tracked.clients";

    private final Map<Outcome, Counter> decisions = new EnumMap<>(Outcome.class);

    public AuthorizationMetrics(MetricFactory metrics, RateLimiter rateLimiter) {
        for (Outcome outcome : Outcome.values()) {
            decisions.put(outcome, metrics.counter(
                    DECISIONS, "Authorization decisions by outcome", "outcome", outcome.name()));
        }
        metrics.gauge(TRACKED_CLIENTS, "Clients with an open rate-limit window", rateLimiter::trackedClients);
    }

    @Override
    public void onDecision(AccessRequest request, AuthorizationDecision decision) {
        decisions.get(decision.outcome()).increment();
    }
}
