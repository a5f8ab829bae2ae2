package com.warden.gateway.config;

import com.warden.security.ClientKeyStrategy;
import com.warden.security.PrivilegeLevel;
import com.warden.security.RateLimitConfig;
import com.warden.security.RoutePolicy;
import com.warden.security.RouteTable;
import com.warden.security.TokenConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the gateway, bound from the {@code warden.*} prefix and validated
 * at startup. Invalid configuration stops the context from starting.
 *
 * <pre>
 * warden:
 *   jwt:
 *     secret: ${WARDEN_JWT_SECRET}
 *     access-token-ttl: 15m
 *   rate-limit:
 *     max-requests: 3
 *     window: 20s
 *   routes:
 *     - path: /admin-demo
 *       policy: token
 *       min-privilege: 2
 * </pre>
 *
 * @param serviceName       name used as the {@code service} metric tag
 * @param jwt               token signing settings; the secret is required
 * @param rateLimit         deployment-wide request budget
 * @param routes            route registrations; paths not listed are open
 * @param clientKeyStrategy how the rate-limit client key is derived
 * @param bcryptStrength    BCrypt log rounds for stored secrets
 * @param seed              optional demo users
 */
@ConfigurationProperties(prefix = "warden")
@Validated
public record WardenProperties(
        @NotBlank String serviceName,
        @Valid @NotNull Jwt jwt,
        @Valid RateLimit rateLimit,
        @Valid List<Route> routes,
        ClientKeyStrategy clientKeyStrategy,
        @Min(4) @Max(31) int bcryptStrength,
        @Valid Seed seed) {

    public WardenProperties {
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = "warden-gateway";
        }
        if (rateLimit == null) {
            rateLimit = new RateLimit(0, null, null);
        }
        routes = routes == null ? List.of() : List.copyOf(routes);
        if (clientKeyStrategy == null) {
            clientKeyStrategy = ClientKeyStrategy.SOURCE_ADDRESS;
        }
        if (bcryptStrength == 0) {
            bcryptStrength = 10;
        }
        if (seed == null) {
            seed = new Seed(false, null, null);
        }
    }

    public TokenConfig tokenConfig() {
        return new TokenConfig(jwt.secret(), jwt.issuer(), jwt.accessTokenTtl(), jwt.refreshTokenTtl());
    }

    public RouteTable routeTable() {
        return RouteTable.of(routes.stream().map(Route::toRoute).toList());
    }

    /**
     * @param secret          HMAC signing secret, at least 32 bytes
     * @param issuer          {@code iss} claim; defaults to {@code warden}
     * @param accessTokenTtl  defaults to 15 minutes
     * @param refreshTokenTtl defaults to 14 days
     */
    public record Jwt(
            @NotBlank String secret,
            String issuer,
            Duration accessTokenTtl,
            Duration refreshTokenTtl) {

        @Override
        public String toString() {
            return "Jwt[secret=****, issuer=" + issuer + ", accessTokenTtl=" + accessTokenTtl
                    + ", refreshTokenTtl=" + refreshTokenTtl + "]";
        }
    }

    /**
     * @param maxRequests   admissions per window; defaults to 3
     * @param window        window length; defaults to 20 seconds
     * @param purgeInterval how often elapsed budgets are dropped; defaults to one minute
     */
    public record RateLimit(@PositiveOrZero int maxRequests, Duration window, Duration purgeInterval) {

        public RateLimit {
            if (maxRequests == 0) {
                maxRequests = RateLimitConfig.DEFAULT.maxRequests();
            }
            if (window == null) {
                window = RateLimitConfig.DEFAULT.window();
            }
            if (purgeInterval == null) {
                purgeInterval = Duration.ofMinutes(1);
            }
        }

        public RateLimitConfig toConfig() {
            return new RateLimitConfig(maxRequests, window);
        }
    }

    /**
     * @param path         exact request path
     * @param policy       protection policy
     * @param password     route password, required for {@code password}
     * @param minPrivilege minimum privilege for {@code token}; defaults to GUEST
     */
    public record Route(
            @NotBlank String path,
            @NotNull RoutePolicy.Kind policy,
            String password,
            @PositiveOrZero Integer minPrivilege) {

        public RouteTable.Route toRoute() {
            RoutePolicy routePolicy = switch (policy) {
                case NONE -> RoutePolicy.none();
                case PASSWORD -> RoutePolicy.password(password);
                case TOKEN -> RoutePolicy.token(
                        minPrivilege == null ? PrivilegeLevel.GUEST : PrivilegeLevel.of(minPrivilege));
            };
            return new RouteTable.Route(path, routePolicy);
        }

        @Override
        public String toString() {
            return "Route[path=" + path + ", policy=" + policy
                    + ", password=" + (password == null ? "none" : "****")
                    + ", minPrivilege=" + minPrivilege + "]";
        }
    }

    /**
     * @param enabled       create the demo users at startup
     * @param userPassword  secret for {@code user@example.com}
     * @param adminPassword secret for {@code admin@example.com}
     */
    public record Seed(boolean enabled, String userPassword, String adminPassword) {

        @Override
        public String toString() {
            return "Seed[enabled=" + enabled + ", userPassword=****, adminPassword=****]";
        }
    }
}
