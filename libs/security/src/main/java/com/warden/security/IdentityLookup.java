package com.warden.security;

import java.util.Optional;

/**
 * Resolves the current identity of an active (not disabled) user.
 */
@FunctionalInterface
public interface IdentityLookup {

    Optional<Identity> findActiveIdentity(String userId);
}
