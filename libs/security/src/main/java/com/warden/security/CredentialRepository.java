package com.warden.security;

import java.util.Optional;

/**
 * Storage port for {@link User} records.
 * <p>
 * Implementations must be thread-safe and must have persisted every mutation by the time the
 * method returns. I/O failures are reported as {@link CredentialStoreException}.
 */
public interface CredentialRepository {

    /**
     * Inserts a new user.
     *
     * @throws DuplicateEmailException if the email is already registered
     */
    void insert(User user);

    Optional<User> findById(String userId);

    /** Looks a user up by normalised email. */
    Optional<User> findByEmail(String email);

    /** Looks a user up by the SHA-256 hex digest of their current API key. */
    Optional<User> findByApiKeyHash(String apiKeyHash);

    /**
     * Replaces the stored API key digest in a single write.
     *
     * @return false if no such user exists
     */
    boolean updateApiKeyHash(String userId, String apiKeyHash);

    boolean updatePrivilege(String userId, PrivilegeLevel privilege);

    boolean updateSecretHash(String userId, String secretHash);

    boolean disable(String userId);
}
