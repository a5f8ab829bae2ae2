package com.warden.gateway.api;

import com.warden.gateway.infrastructure.web.AuthorizationFilter;
import com.warden.security.Identity;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;

/**
 * Sample endpoints, one per protection policy. The protection itself comes from
 * {@code warden.routes}; these handlers only run once the request has been allowed.
 */
@RestController
public class DemoController {

    @GetMapping("/guest-demo")
    public Map<String, Object> guestDemo() {
        return Map.of("message", "Hello, guest");
    }

    @GetMapping("/password-route")
    public Map<String, Object> passwordRoute() {
        return Map.of("message", "Password accepted");
    }

    @GetMapping("/admin-demo")
    public Map<String, Object> adminDemo(
            @RequestAttribute(name = AuthorizationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity) {
        return describe("Hello, admin", identity);
    }

    @GetMapping("/api/protected/data")
    public Map<String, Object> protectedData(
            @RequestAttribute(name = AuthorizationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity) {
        return describe("Protected data", identity);
    }

    private static Map<String, Object> describe(String message, Identity identity) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        if (identity != null) {
            body.put("userId", identity.userId());
            body.put("privilege", identity.privilege().value());
        }
        return body;
    }
}
