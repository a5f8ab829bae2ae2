package com.warden.security;

import java.time.Instant;
import java.util.Objects;

/**
 * Server-side state of an issued refresh token.
 *
 * @param tokenId   the token's {@code jti}
 * @param userId    owner
 * @param issuedAt  issue time
 * @param expiresAt expiry time
 * @param revokedAt revocation time, or null while the token is still redeemable
 */
public record RefreshTokenRecord(
        String tokenId,
        String userId,
        Instant issuedAt,
        Instant expiresAt,
        Instant revokedAt
) {

    public RefreshTokenRecord {
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isActive(Instant now) {
        return revokedAt == null && now.isBefore(expiresAt);
    }

    public RefreshTokenRecord revokedAt(Instant when) {
        return new RefreshTokenRecord(tokenId, userId, issuedAt, expiresAt, when);
    }
}
