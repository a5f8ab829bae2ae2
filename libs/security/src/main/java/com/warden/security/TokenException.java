package com.warden.security;

/**
 * Thrown when an access or refresh token cannot be accepted.
 * <p>
 * {@link #getMessage()} is identical for all failures. The specific {@link TokenFailure} is
 * available to code and logs via {@link #failure()} but must not be sent to clients.
 */
public class TokenException extends RuntimeException {

    public static final String MESSAGE = "Invalid or expired token";

    /** Why a token was rejected. */
    public enum TokenFailure {
        EXPIRED,
        BAD_SIGNATURE,
        REVOKED
    }

    private final TokenFailure failure;

    public TokenException(TokenFailure failure) {
        super(MESSAGE);
        this.failure = failure;
    }

    public TokenException(TokenFailure failure, Throwable cause) {
        super(MESSAGE, cause);
        this.failure = failure;
    }

    public TokenFailure failure() {
        return failure;
    }
}
