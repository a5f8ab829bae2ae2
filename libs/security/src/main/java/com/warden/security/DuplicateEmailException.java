package com.warden.security;

/**
 * Thrown when a user is registered with an email that is already taken.
 * Callers may retry with a different email.
 */
public class DuplicateEmailException extends RuntimeException {

    public DuplicateEmailException(String email) {
        super("A user with email '%s' already exists".formatted(email));
    }
}
