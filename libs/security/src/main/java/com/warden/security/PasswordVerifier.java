package com.warden.security;

import java.security.MessageDigest;

/**
 * Constant-time check of a per-route static password.
 * <p>
 * Both values are digested first, so the comparison always runs over 32 bytes regardless of
 * the provided length or of where the first differing character sits. Comparison is
 * case-sensitive.
 */
public final class PasswordVerifier {

    private PasswordVerifier() {
        // utility class
    }

    public static boolean check(String routeSecret, String provided) {
        if (routeSecret == null || provided == null) {
            return false;
        }
        return MessageDigest.isEqual(Digests.sha256(routeSecret), Digests.sha256(provided));
    }
}
