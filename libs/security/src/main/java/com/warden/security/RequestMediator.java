package com.warden.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Single entry point every inbound request passes through.
 * <p>
 * Checks run in a fixed order and the first failure is final:
 * <ol>
 *   <li>rate check, for every path regardless of policy;</li>
 *   <li>credential check, for {@code PASSWORD} and {@code TOKEN} routes;</li>
 *   <li>privilege check, for {@code TOKEN} routes.</li>
 * </ol>
 * Paths missing from the {@link RouteTable} are treated as {@link RoutePolicy#none()}.
 * <p>
 * On {@code TOKEN} routes a bearer credential carrying the {@link ApiKey#PREFIX} is resolved
 * through the {@link CredentialStore}; anything else is validated as an access token.
 * {@link CredentialStoreException} is not caught here: storage failures reach the caller as
 * service failures, never as credential rejections.
 */
public class RequestMediator {

    private static final Logger log = LoggerFactory.getLogger(RequestMediator.class);

    private final RouteTable routes;
    private final RateLimiter rateLimiter;
    private final TokenService tokenService;
    private final CredentialStore credentialStore;
    private final ClientKeyStrategy clientKeyStrategy;
    private final AuthorizationListener listener;

    public RequestMediator(RouteTable routes,
                           RateLimiter rateLimiter,
                           TokenService tokenService,
                           CredentialStore credentialStore,
                           ClientKeyStrategy clientKeyStrategy,
                           AuthorizationListener listener) {
        this.routes = Objects.requireNonNull(routes, "routes");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.tokenService = Objects.requireNonNull(tokenService, "tokenService");
        this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore");
        this.clientKeyStrategy = Objects.requireNonNull(clientKeyStrategy, "clientKeyStrategy");
        this.listener = listener == null ? AuthorizationListener.NOOP : listener;
    }

    public AuthorizationDecision mediate(AccessRequest request) {
        AuthorizationDecision decision = decide(request);
        if (!decision.allowed()) {
            log.debug("Rejected {} {}: {}", request.path(), request.clientAddress(), decision.outcome());
        }
        listener.onDecision(request, decision);
        return decision;
    }

    public RouteTable routes() {
        return routes;
    }

    private AuthorizationDecision decide(AccessRequest request) {
        RateLimitResult rate = rateLimiter.admit(clientKeyStrategy.clientKey(request));
        if (!rate.allowed()) {
            return AuthorizationDecision.rateExceeded(rate.retryAfter());
        }

        RoutePolicy policy = routes.policyFor(request.path()).orElse(RoutePolicy.none());
        return switch (policy.kind()) {
            case NONE -> AuthorizationDecision.allow(null);
            case PASSWORD -> PasswordVerifier.check(policy.secret(), request.routePassword())
                    ? AuthorizationDecision.allow(null)
                    : AuthorizationDecision.invalidCredentials();
            case TOKEN -> authorizeBearer(request.bearerCredential(), policy.minPrivilege());
        };
    }

    private AuthorizationDecision authorizeBearer(String credential, PrivilegeLevel required) {
        if (credential == null || credential.isBlank()) {
            return AuthorizationDecision.invalidCredentials();
        }

        Identity identity;
        try {
            identity = ApiKey.looksLikeApiKey(credential)
                    ? credentialStore.lookupByApiKey(credential)
                    : tokenService.validateAccessToken(credential);
        } catch (InvalidCredentialsException e) {
            return AuthorizationDecision.invalidCredentials();
        } catch (TokenException e) {
            log.debug("Bearer token rejected: {}", e.failure());
            return AuthorizationDecision.invalidCredentials();
        }

        try {
            PrivilegeGate.authorize(identity.privilege(), required);
        } catch (InsufficientPrivilegeException e) {
            log.debug("User {} has {} but route requires {}", identity.userId(), e.actual(), e.required());
            return AuthorizationDecision.insufficientPrivilege();
        }
        return AuthorizationDecision.allow(identity);
    }
}
