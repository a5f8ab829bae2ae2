package com.warden.security;

import java.util.Objects;

/**
 * Protection scheme attached to one route at registration time.
 * <p>
 * Use the factories: {@link #none()}, {@link #password(String)}, {@link #token(PrivilegeLevel)}.
 * {@link #toString()} never prints the route secret.
 */
public final class RoutePolicy {

    /** Which checks a route requires after the rate check. */
    public enum Kind {
        NONE,
        PASSWORD,
        TOKEN
    }

    private static final RoutePolicy NONE = new RoutePolicy(Kind.NONE, null, PrivilegeLevel.GUEST);

    private final Kind kind;
    private final String secret;
    private final PrivilegeLevel minPrivilege;

    private RoutePolicy(Kind kind, String secret, PrivilegeLevel minPrivilege) {
        this.kind = kind;
        this.secret = secret;
        this.minPrivilege = minPrivilege;
    }

    public static RoutePolicy none() {
        return NONE;
    }

    public static RoutePolicy password(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("route password must not be empty");
        }
        return new RoutePolicy(Kind.PASSWORD, secret, PrivilegeLevel.GUEST);
    }

    public static RoutePolicy token(PrivilegeLevel minPrivilege) {
        return new RoutePolicy(Kind.TOKEN, null, Objects.requireNonNull(minPrivilege, "minPrivilege"));
    }

    public Kind kind() {
        return kind;
    }

    /** The route password; null unless {@link #kind()} is {@code PASSWORD}. */
    public String secret() {
        return secret;
    }

    public PrivilegeLevel minPrivilege() {
        return minPrivilege;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RoutePolicy other)) {
            return false;
        }
        return kind == other.kind
                && Objects.equals(secret, other.secret)
                && minPrivilege.equals(other.minPrivilege);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, secret, minPrivilege);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "RoutePolicy[none]";
            case PASSWORD -> "RoutePolicy[password=****]";
            case TOKEN -> "RoutePolicy[token, minPrivilege=" + minPrivilege + "]";
        };
    }
}
