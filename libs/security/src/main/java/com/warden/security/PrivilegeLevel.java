package com.warden.security;

/**
 * Ordered authorization tier of a principal.
 * <p>
 * Levels are plain non-negative integers so deployments can define tiers beyond the named
 * ones. A level satisfies a requirement iff it is greater than or equal to it.
 *
 * @param value the numeric level (0 = guest)
 */
public record PrivilegeLevel(int value) implements Comparable<PrivilegeLevel> {

    /** Unauthenticated callers. */
    public static final PrivilegeLevel GUEST = new PrivilegeLevel(0);

    /** Standard registered users. */
    public static final PrivilegeLevel USER = new PrivilegeLevel(1);

    /** Administrators. */
    public static final PrivilegeLevel ADMIN = new PrivilegeLevel(2);

    public PrivilegeLevel {
        if (value < 0) {
            throw new IllegalArgumentException("privilege level must not be negative: " + value);
        }
    }

    public static PrivilegeLevel of(int value) {
        return switch (value) {
            case 0 -> GUEST;
            case 1 -> USER;
            case 2 -> ADMIN;
            default -> new PrivilegeLevel(value);
        };
    }

    /**
     * Returns true when this level meets {@code required}. Equality counts as meeting it.
     */
    public boolean satisfies(PrivilegeLevel required) {
        return compareTo(required) >= 0;
    }

    @Override
    public int compareTo(PrivilegeLevel other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return switch (value) {
            case 0 -> "GUEST(0)";
            case 1 -> "USER(1)";
            case 2 -> "ADMIN(2)";
            default -> "LEVEL(" + value + ")";
        };
    }
}
