package com.warden.security;

/**
 * Decides whether a privilege level meets a route's minimum. Pure and total.
 */
public final class PrivilegeGate {

    private PrivilegeGate() {
        // utility class
    }

    public static boolean isAllowed(PrivilegeLevel actual, PrivilegeLevel required) {
        return actual.satisfies(required);
    }

    /**
     * @throws InsufficientPrivilegeException if {@code actual} is below {@code required}
     */
    public static void authorize(PrivilegeLevel actual, PrivilegeLevel required) {
        if (!isAllowed(actual, required)) {
            throw new InsufficientPrivilegeException(actual, required);
        }
    }
}
