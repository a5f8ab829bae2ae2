package com.warden.security;

import java.time.Duration;
import java.util.Optional;

/**
 * The single outcome of mediating one request.
 *
 * @param outcome    what happened
 * @param identity   resolved principal on {@code ALLOW} for authenticated routes, otherwise null
 * @param retryAfter time until the budget resets on {@code RATE_EXCEEDED}, otherwise zero
 */
public record AuthorizationDecision(Outcome outcome, Identity identity, Duration retryAfter) {

    /** Decision outcomes. Mapping them onto a wire protocol is the transport's job. */
    public enum Outcome {
        ALLOW,
        RATE_EXCEEDED,
        INVALID_CREDENTIALS,
        INSUFFICIENT_PRIVILEGE
    }

    public static AuthorizationDecision allow(Identity identity) {
        return new AuthorizationDecision(Outcome.ALLOW, identity, Duration.ZERO);
    }

    public static AuthorizationDecision rateExceeded(Duration retryAfter) {
        return new AuthorizationDecision(Outcome.RATE_EXCEEDED, null, retryAfter);
    }

    public static AuthorizationDecision invalidCredentials() {
        return new AuthorizationDecision(Outcome.INVALID_CREDENTIALS, null, Duration.ZERO);
    }

    public static AuthorizationDecision insufficientPrivilege() {
        return new AuthorizationDecision(Outcome.INSUFFICIENT_PRIVILEGE, null, Duration.ZERO);
    }

    public boolean allowed() {
        return outcome == Outcome.ALLOW;
    }

    public Optional<Identity> resolvedIdentity() {
        return Optional.ofNullable(identity);
    }
}
