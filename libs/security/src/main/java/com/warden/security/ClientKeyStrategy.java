package com.warden.security;

/**
 * How {@link RequestMediator} derives the rate-limit client key from a request.
 * <p>
 * The rate check runs before any credential is verified, so credential-based keys use the
 * presented (unverified) bearer credential. They are digested so raw tokens never sit in the
 * budget table.
 */
public enum ClientKeyStrategy {

    /** Budget per source address. */
    SOURCE_ADDRESS {
        @Override
        public String clientKey(AccessRequest request) {
            return "addr:" + request.clientAddress();
        }
    },

    /** Budget per presented bearer credential, falling back to the source address. */
    CREDENTIAL_OR_SOURCE_ADDRESS {
        @Override
        public String clientKey(AccessRequest request) {
            String credential = request.bearerCredential();
            if (credential == null || credential.isBlank()) {
                return SOURCE_ADDRESS.clientKey(request);
            }
            return "cred:" + Digests.sha256Hex(credential);
        }
    };

    public abstract String clientKey(AccessRequest request);
}
