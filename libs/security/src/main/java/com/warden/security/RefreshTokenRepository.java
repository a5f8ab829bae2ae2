package com.warden.security;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage port for refresh-token revocation state.
 */
public interface RefreshTokenRepository {

    void save(RefreshTokenRecord record);

    Optional<RefreshTokenRecord> findById(String tokenId);

    /**
     * Atomically revokes {@code oldTokenId} and records {@code replacement}.
     * <p>
     * Succeeds only if the old token exists, is not revoked and has not expired at {@code now}.
     * Of any number of concurrent calls for the same old token at most one returns true.
     *
     * @return true if the rotation happened
     */
    boolean rotate(String oldTokenId, RefreshTokenRecord replacement, Instant now);

    /**
     * Revokes a single token. Already-revoked tokens are left untouched.
     *
     * @return true if the token was active and is now revoked
     */
    boolean revoke(String tokenId, Instant now);

    /**
     * Revokes every active token owned by {@code userId}.
     *
     * @return number of tokens revoked
     */
    int revokeAllForUser(String userId, Instant now);
}
