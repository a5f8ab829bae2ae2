package com.warden.gateway.config;

import com.warden.observability.SensitiveDataRedactor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs the effective {@code warden.*} configuration once the application is ready, with secrets
 * redacted.
 */
@Component
public class EffectiveConfigurationLogger {

    private static final Logger log = LoggerFactory.getLogger(EffectiveConfigurationLogger.class);

    private final WardenProperties properties;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    public EffectiveConfigurationLogger(WardenProperties properties) {
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logEffectiveConfiguration() {
        log.info("Effective configuration: {}", redactor.redact(flatten(properties)));
    }

    static Map<String, Object> flatten(WardenProperties properties) {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("warden.service-name", properties.serviceName());
        entries.put("warden.jwt.secret", properties.jwt().secret());
        entries.put("warden.jwt.issuer", properties.jwt().issuer());
        entries.put("warden.jwt.access-token-ttl", properties.jwt().accessTokenTtl());
        entries.put("warden.jwt.refresh-token-ttl", properties.jwt().refreshTokenTtl());
        entries.put("warden.rate-limit.max-requests", properties.rateLimit().maxRequests());
        entries.put("warden.rate-limit.window", properties.rateLimit().window());
        entries.put("warden.client-key-strategy", properties.clientKeyStrategy());
        entries.put("warden.bcrypt-strength", properties.bcryptStrength());
        entries.put("warden.seed.enabled", properties.seed().enabled());
        entries.put("warden.seed.user-password", properties.seed().userPassword());
        entries.put("warden.seed.admin-password", properties.seed().adminPassword());
        List<WardenProperties.Route> routes = properties.routes();
        for (int i = 0; i < routes.size(); i++) {
            WardenProperties.Route route = routes.get(i);
            String prefix = "warden.routes[" + i + "].";
            entries.put(prefix + "path", route.path());
            entries.put(prefix + "policy", route.policy());
            if (route.password() != null) {
                entries.put(prefix + "password", route.password());
            }
            if (route.minPrivilege() != null) {
                entries.put(prefix + "min-privilege", route.minPrivilege());
            }
        }
        return entries;
    }
}
