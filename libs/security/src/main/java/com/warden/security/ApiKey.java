package com.warden.security;

import java.util.Objects;

/**
 * A freshly issued API key. The plaintext exists only in this object and is handed to the
 * caller once; the store keeps its SHA-256 digest.
 *
 * @param value the plaintext key, prefixed with {@value #PREFIX}
 */
public record ApiKey(String value) {

    /** Prefix that marks a bearer credential as an API key rather than a JWT. */
    public static final String PREFIX = "wk_";

    public ApiKey {
        Objects.requireNonNull(value, "value");
    }

    public static boolean looksLikeApiKey(String credential) {
        return credential != null && credential.startsWith(PREFIX);
    }

    @Override
    public String toString() {
        return "ApiKey[****]";
    }
}
