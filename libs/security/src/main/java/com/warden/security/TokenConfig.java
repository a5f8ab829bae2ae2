package com.warden.security;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Signing and lifetime settings for {@link TokenService}, supplied once at startup.
 * <p>
 * The compact constructor rejects a missing or short signing secret with
 * {@link SigningKeyException}; HS256 needs at least {@value #MIN_SECRET_BYTES} bytes of key.
 *
 * @param signingSecret   HMAC secret (UTF-8 encoded into the key)
 * @param issuer          value of the {@code iss} claim; defaults to {@code warden}
 * @param accessTokenTtl  access-token lifetime; defaults to 15 minutes
 * @param refreshTokenTtl refresh-token lifetime; defaults to 14 days
 */
public record TokenConfig(
        String signingSecret,
        String issuer,
        Duration accessTokenTtl,
        Duration refreshTokenTtl
) {

    public static final int MIN_SECRET_BYTES = 32;

    public static final Duration DEFAULT_ACCESS_TOKEN_TTL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_REFRESH_TOKEN_TTL = Duration.ofDays(14);

    public TokenConfig {
        if (signingSecret == null || signingSecret.isBlank()) {
            throw new SigningKeyException("Token signing secret is not configured");
        }
        if (signingSecret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new SigningKeyException(
                    "Token signing secret must be at least %d bytes".formatted(MIN_SECRET_BYTES));
        }
        if (issuer == null || issuer.isBlank()) {
            issuer = "warden";
        }
        if (accessTokenTtl == null) {
            accessTokenTtl = DEFAULT_ACCESS_TOKEN_TTL;
        }
        if (refreshTokenTtl == null) {
            refreshTokenTtl = DEFAULT_REFRESH_TOKEN_TTL;
        }
        if (accessTokenTtl.isNegative() || accessTokenTtl.isZero()
                || refreshTokenTtl.isNegative() || refreshTokenTtl.isZero()) {
            throw new IllegalArgumentException("token lifetimes must be positive");
        }
    }

    public static TokenConfig withDefaults(String signingSecret) {
        return new TokenConfig(signingSecret, null, null, null);
    }

    @Override
    public String toString() {
        return "TokenConfig[signingSecret=****, issuer=" + issuer
                + ", accessTokenTtl=" + accessTokenTtl + ", refreshTokenTtl=" + refreshTokenTtl + "]";
    }
}
