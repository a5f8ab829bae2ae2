package com.warden.security;

import java.util.Objects;

/**
 * The principal resolved for a request after a successful credential check.
 *
 * @param userId    stable user identifier
 * @param email     the user's (normalised) email address
 * @param privilege the privilege level in effect for this request
 */
public record Identity(String userId, String email, PrivilegeLevel privilege) {

    public Identity {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(privilege, "privilege");
    }
}
