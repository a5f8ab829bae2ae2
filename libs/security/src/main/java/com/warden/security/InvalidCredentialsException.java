package com.warden.security;

/**
 * Thrown when a secret, API key or route password does not check out.
 * <p>
 * The message is the same for every cause (unknown user, wrong secret, disabled account,
 * unknown key) so responses never reveal which check failed.
 */
public class InvalidCredentialsException extends RuntimeException {

    public static final String MESSAGE = "Invalid credentials";

    public InvalidCredentialsException() {
        super(MESSAGE);
    }
}
