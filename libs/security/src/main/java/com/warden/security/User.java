package com.warden.security;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted user record as held by a {@link CredentialRepository}.
 * <p>
 * Only hashes are stored: {@code secretHash} is a BCrypt hash of the login secret and
 * {@code apiKeyHash} is the SHA-256 hex digest of the current API key (null until one is
 * issued). Users are never deleted; {@code disabled} soft-disables them.
 */
public record User(
        String userId,
        String email,
        String secretHash,
        String apiKeyHash,
        PrivilegeLevel privilege,
        Instant createdAt,
        boolean disabled
) {

    public User {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(secretHash, "secretHash");
        Objects.requireNonNull(privilege, "privilege");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public Identity toIdentity() {
        return new Identity(userId, email, privilege);
    }

    public User withSecretHash(String newSecretHash) {
        return new User(userId, email, newSecretHash, apiKeyHash, privilege, createdAt, disabled);
    }

    public User withApiKeyHash(String newApiKeyHash) {
        return new User(userId, email, secretHash, newApiKeyHash, privilege, createdAt, disabled);
    }

    public User withPrivilege(PrivilegeLevel newPrivilege) {
        return new User(userId, email, secretHash, apiKeyHash, newPrivilege, createdAt, disabled);
    }

    public User asDisabled() {
        return new User(userId, email, secretHash, apiKeyHash, privilege, createdAt, true);
    }

    @Override
    public String toString() {
        return "User[userId=" + userId + ", email=" + email + ", privilege=" + privilege
                + ", createdAt=" + createdAt + ", disabled=" + disabled + "]";
    }
}
