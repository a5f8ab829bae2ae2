package com.warden.security;

import java.util.Objects;

/**
 * Transport-neutral facts about an inbound request, as needed by {@link RequestMediator}.
 *
 * @param path             request path, matched exactly against the {@link RouteTable}
 * @param clientAddress    source address of the caller
 * @param bearerCredential bearer token or API key from the Authorization header, or null
 * @param routePassword    password supplied for password-protected routes, or null
 */
public record AccessRequest(String path, String clientAddress, String bearerCredential, String routePassword) {

    public AccessRequest {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(clientAddress, "clientAddress");
    }

    @Override
    public String toString() {
        return "AccessRequest[path=" + path + ", clientAddress=" + clientAddress
                + ", bearerCredential=" + (bearerCredential == null ? "none" : "****")
                + ", routePassword=" + (routePassword == null ? "none" : "****") + "]";
    }
}
