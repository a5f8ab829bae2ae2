package com.warden.security;

import java.time.Instant;

/**
 * Signed refresh token. Its {@code tokenId} is the key of the persisted
 * {@link RefreshTokenRecord} that tracks revocation.
 *
 * @param value     compact JWT
 * @param tokenId   the {@code jti} claim
 * @param expiresAt expiry instant (second precision)
 */
public record RefreshToken(String value, String tokenId, Instant expiresAt) {

    @Override
    public String toString() {
        return "RefreshToken[tokenId=" + tokenId + ", expiresAt=" + expiresAt + "]";
    }
}
