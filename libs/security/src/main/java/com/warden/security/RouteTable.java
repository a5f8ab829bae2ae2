package com.warden.security;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup table from request path to {@link RoutePolicy}, built once at startup.
 */
public final class RouteTable {

    /**
     * One registration entry.
     *
     * @param path   exact request path, starting with {@code /}
     * @param policy protection policy
     */
    public record Route(String path, RoutePolicy policy) {

        public Route {
            if (path == null || !path.startsWith("/")) {
                throw new IllegalArgumentException("route path must start with '/': " + path);
            }
            if (policy == null) {
                throw new IllegalArgumentException("route policy must not be null: " + path);
            }
        }
    }

    private final Map<String, RoutePolicy> policies;

    private RouteTable(Map<String, RoutePolicy> policies) {
        this.policies = policies;
    }

    /**
     * @throws IllegalArgumentException if a path is registered twice
     */
    public static RouteTable of(Collection<Route> routes) {
        var policies = new LinkedHashMap<String, RoutePolicy>();
        for (Route route : routes) {
            if (policies.putIfAbsent(route.path(), route.policy()) != null) {
                throw new IllegalArgumentException("duplicate route path: " + route.path());
            }
        }
        return new RouteTable(Map.copyOf(policies));
    }

    public static RouteTable empty() {
        return new RouteTable(Map.of());
    }

    public Optional<RoutePolicy> policyFor(String path) {
        return Optional.ofNullable(policies.get(path));
    }

    public int size() {
        return policies.size();
    }

    public Map<String, RoutePolicy> asMap() {
        return policies;
    }
}
