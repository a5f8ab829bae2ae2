package com.warden.security;

/**
 * Thrown when an authenticated principal's privilege is below a route's minimum.
 */
public class InsufficientPrivilegeException extends RuntimeException {

    private final PrivilegeLevel actual;
    private final PrivilegeLevel required;

    public InsufficientPrivilegeException(PrivilegeLevel actual, PrivilegeLevel required) {
        super("Insufficient privileges");
        this.actual = actual;
        this.required = required;
    }

    public PrivilegeLevel actual() {
        return actual;
    }

    public PrivilegeLevel required() {
        return required;
    }
}
