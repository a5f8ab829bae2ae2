package com.warden.security;

/**
 * Thrown when the credential or refresh-token storage cannot be reached or written.
 * <p>
 * This is a service failure for the current request and is never reported as
 * {@link InvalidCredentialsException}.
 */
public class CredentialStoreException extends RuntimeException {

    public CredentialStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
