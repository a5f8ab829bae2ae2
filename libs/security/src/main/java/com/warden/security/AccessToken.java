package com.warden.security;

import java.time.Instant;

/**
 * Signed, stateless access token.
 *
 * @param value     compact JWT
 * @param expiresAt expiry instant (second precision)
 */
public record AccessToken(String value, Instant expiresAt) {

    @Override
    public String toString() {
        return "AccessToken[expiresAt=" + expiresAt + "]";
    }
}
