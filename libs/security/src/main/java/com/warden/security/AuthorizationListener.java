package com.warden.security;

/**
 * Observer notified once per mediated request. Implementations must not throw.
 */
@FunctionalInterface
public interface AuthorizationListener {

    AuthorizationListener NOOP = (request, decision) -> { };

    void onDecision(AccessRequest request, AuthorizationDecision decision);
}
