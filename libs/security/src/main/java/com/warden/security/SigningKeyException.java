package com.warden.security;

/**
 * Thrown at startup when the token signing key is missing or too weak. The process must not
 * start without a usable key.
 */
public class SigningKeyException extends RuntimeException {

    public SigningKeyException(String message) {
        super(message);
    }

    public SigningKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
