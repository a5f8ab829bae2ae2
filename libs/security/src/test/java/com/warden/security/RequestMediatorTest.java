package com.warden.security;

import com.warden.security.AuthorizationDecision.Outcome;
import com.warden.security.testing.InMemoryCredentialRepository;
import com.warden.security.testing.InMemoryRefreshTokenRepository;
import com.warden.security.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("RequestMediator")
class RequestMediatorTest {

    private static final String CLIENT = "203.0.113.7";

    private MutableClock clock;
    private CredentialStore credentials;
    private TokenService tokens;
    private RouteTable routes;
    private List<AuthorizationDecision> observed;
    private RequestMediator mediator;

    private Identity user;
    private Identity admin;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        credentials = new CredentialStore(new InMemoryCredentialRepository(), new BCryptPasswordEncoder(4), clock);
        tokens = new TokenService(TokenConfig.withDefaults(TokenServiceTest.SECRET),
                new InMemoryRefreshTokenRepository(), credentials, clock);
        routes = RouteTable.of(List.of(
                new RouteTable.Route("/guest-demo", RoutePolicy.none()),
                new RouteTable.Route("/password-route", RoutePolicy.password("Password123")),
                new RouteTable.Route("/api/protected/data", RoutePolicy.token(PrivilegeLevel.USER)),
                new RouteTable.Route("/admin-demo", RoutePolicy.token(PrivilegeLevel.ADMIN))));
        observed = new ArrayList<>();
        mediator = newMediator(credentials, RateLimitConfig.of(3, 20), ClientKeyStrategy.SOURCE_ADDRESS);

        user = credentials.findActiveIdentity(
                credentials.createUser("user@example.com", "user-secret", PrivilegeLevel.USER)).orElseThrow();
        admin = credentials.findActiveIdentity(
                credentials.createUser("admin@example.com", "admin-secret", PrivilegeLevel.ADMIN)).orElseThrow();
    }

    private RequestMediator newMediator(CredentialStore store, RateLimitConfig limit, ClientKeyStrategy strategy) {
        return new RequestMediator(routes, new RateLimiter(limit, clock), tokens, store, strategy,
                (request, decision) -> observed.add(decision));
    }

    private static AccessRequest request(String path, String bearer, String password) {
        return new AccessRequest(path, CLIENT, bearer, password);
    }

    private String bearerFor(Identity identity) {
        return tokens.issueAccessToken(identity).value();
    }

    @Nested
    @DisplayName("rate check")
    class RateCheck {

        @Test
        @DisplayName("runs first and short-circuits the remaining checks")
        void firstAndFinal() {
            for (int i = 0; i < 3; i++) {
                mediator.mediate(request("/guest-demo", null, null));
            }

            AuthorizationDecision decision = mediator.mediate(request("/admin-demo", bearerFor(admin), null));

            assertThat(decision.outcome()).isEqualTo(Outcome.RATE_EXCEEDED);
            assertThat(decision.retryAfter()).isEqualTo(Duration.ofSeconds(20));
            assertThat(decision.identity()).isNull();
        }

        @Test
        @DisplayName("is reported before bad credentials")
        void beforeCredentials() {
            for (int i = 0; i < 3; i++) {
                mediator.mediate(request("/admin-demo", "garbage", null));
            }

            assertThat(mediator.mediate(request("/admin-demo", "garbage", null)).outcome())
                    .isEqualTo(Outcome.RATE_EXCEEDED);
        }

        @Test
        @DisplayName("admits again once the window has passed")
        void windowResets() {
            for (int i = 0; i < 4; i++) {
                mediator.mediate(request("/guest-demo", null, null));
            }
            clock.advance(Duration.ofSeconds(20));

            assertThat(mediator.mediate(request("/guest-demo", null, null)).allowed()).isTrue();
        }

        @Test
        @DisplayName("budgets per presented credential when configured to")
        void perCredential() {
            var perCredential = newMediator(credentials, RateLimitConfig.of(1, 20),
                    ClientKeyStrategy.CREDENTIAL_OR_SOURCE_ADDRESS);

            assertThat(perCredential.mediate(request("/api/protected/data", bearerFor(user), null)).allowed()).isTrue();
            assertThat(perCredential.mediate(request("/admin-demo", bearerFor(admin), null)).allowed()).isTrue();
            assertThat(perCredential.mediate(request("/guest-demo", null, null)).allowed()).isTrue();
            assertThat(perCredential.mediate(request("/guest-demo", null, null)).outcome())
                    .isEqualTo(Outcome.RATE_EXCEEDED);
        }
    }

    @Nested
    @DisplayName("policy none")
    class PolicyNone {

        @Test
        @DisplayName("allows without credentials")
        void allows() {
            AuthorizationDecision decision = mediator.mediate(request("/guest-demo", null, null));

            assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW);
            assertThat(decision.resolvedIdentity()).isEmpty();
        }

        @Test
        @DisplayName("ignores an invalid bearer credential")
        void ignoresBearer() {
            assertThat(mediator.mediate(request("/guest-demo", "garbage", null)).allowed()).isTrue();
        }

        @Test
        @DisplayName("applies to unregistered paths")
        void unregisteredPath() {
            assertThat(mediator.mediate(request("/not-registered", null, null)).outcome()).isEqualTo(Outcome.ALLOW);
        }
    }

    @Nested
    @DisplayName("policy password")
    class PolicyPassword {

        @Test
        @DisplayName("allows the exact password")
        void exact() {
            assertThat(mediator.mediate(request("/password-route", null, "Password123")).outcome())
                    .isEqualTo(Outcome.ALLOW);
        }

        @Test
        @DisplayName("rejects a case mismatch")
        void caseMismatch() {
            assertThat(mediator.mediate(request("/password-route", null, "password123")).outcome())
                    .isEqualTo(Outcome.INVALID_CREDENTIALS);
        }

        @Test
        @DisplayName("rejects a missing password")
        void missing() {
            assertThat(mediator.mediate(request("/password-route", null, null)).outcome())
                    .isEqualTo(Outcome.INVALID_CREDENTIALS);
        }
    }

    @Nested
    @DisplayName("policy token")
    class PolicyToken {

        @Test
        @DisplayName("rejects a missing token")
        void missingToken() {
            assertThat(mediator.mediate(request("/api/protected/data", null, null)).outcome())
                    .isEqualTo(Outcome.INVALID_CREDENTIALS);
        }

        @Test
        @DisplayName("rejects an invalid token")
        void invalidToken() {
            assertThat(mediator.mediate(request("/api/protected/data", "not-a-jwt", null)).outcome())
                    .isEqualTo(Outcome.INVALID_CREDENTIALS);
        }

        @Test
        @DisplayName("rejects an expired token")
        void expiredToken() {
            String token = bearerFor(user);
            clock.advance(Duration.ofMinutes(16));

            assertThat(mediator.mediate(request("/api/protected/data", token, null)).outcome())
                    .isEqualTo(Outcome.INVALID_CREDENTIALS);
        }

        @Test
        @DisplayName("rejects a user below the required level")
        void insufficientPrivilege() {
            AuthorizationDecision decision = mediator.mediate(request("/admin-demo", bearerFor(user), null));

            assertThat(decision.outcome()).isEqualTo(Outcome.INSUFFICIENT_PRIVILEGE);
            assertThat(decision.resolvedIdentity()).isEmpty();
        }

        @Test
        @DisplayName("allows a sufficient level and exposes the identity")
        void allowsWithIdentity() {
            AuthorizationDecision decision = mediator.mediate(request("/admin-demo", bearerFor(admin), null));

            assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW);
            assertThat(decision.resolvedIdentity()).contains(admin);
        }

        @Test
        @DisplayName("allows a level equal to the requirement")
        void equalLevel() {
            assertThat(mediator.mediate(request("/api/protected/data", bearerFor(user), null)).resolvedIdentity())
                    .contains(user);
        }

        @Test
        @DisplayName("accepts an API key as the bearer credential")
        void apiKey() {
            ApiKey key = credentials.rotateApiKey(admin.userId());

            AuthorizationDecision decision = mediator.mediate(request("/admin-demo", key.value(), null));

            assertThat(decision.resolvedIdentity()).contains(admin);
        }

        @Test
        @DisplayName("rejects an unknown API key")
        void unknownApiKey() {
            assertThat(mediator.mediate(request("/api/protected/data", ApiKey.PREFIX + "unknown", null)).outcome())
                    .isEqualTo(Outcome.INVALID_CREDENTIALS);
        }

        @Test
        @DisplayName("propagates storage failures instead of rejecting the credential")
        void storageFailure() {
            CredentialRepository broken = mock(CredentialRepository.class);
            when(broken.findByApiKeyHash(anyString()))
                    .thenThrow(new CredentialStoreException("connection refused", null));
            var brokenStore = new CredentialStore(broken, new BCryptPasswordEncoder(4), clock);
            var brokenMediator = newMediator(brokenStore, RateLimitConfig.of(3, 20), ClientKeyStrategy.SOURCE_ADDRESS);

            assertThatThrownBy(() -> brokenMediator.mediate(request("/api/protected/data", ApiKey.PREFIX + "abc", null)))
                    .isInstanceOf(CredentialStoreException.class);
        }
    }

    @Test
    @DisplayName("reports every decision to the listener")
    void listenerSeesDecisions() {
        mediator.mediate(request("/guest-demo", null, null));
        mediator.mediate(request("/password-route", null, "wrong"));
        mediator.mediate(request("/admin-demo", bearerFor(user), null));
        mediator.mediate(request("/guest-demo", null, null));

        assertThat(observed).extracting(AuthorizationDecision::outcome).containsExactly(
                Outcome.ALLOW, Outcome.INVALID_CREDENTIALS, Outcome.INSUFFICIENT_PRIVILEGE, Outcome.RATE_EXCEEDED);
    }
}
