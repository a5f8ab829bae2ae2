package com.warden.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.observability.SensitiveDataRedactor;
import com.warden.security.RoutePolicy;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EffectiveConfigurationLogger")
class EffectiveConfigurationLoggerTest {

    @Test
    @DisplayName("flattens the configuration and redacts every secret")
    void redactsSecrets() {
        var props = new WardenProperties(
                "svc",
                new WardenProperties.Jwt("logger-test-secret-0123456789abcdef", null, Duration.ofMinutes(5), null),
                null,
                List.of(new WardenProperties.Route("/pw", RoutePolicy.Kind.PASSWORD, "Password123", null)),
                null,
                4,
                new WardenProperties.Seed(true, "user-pass-1", "admin-pass-1"));

        Map<String, Object> logged = new SensitiveDataRedactor().redact(EffectiveConfigurationLogger.flatten(props));

        assertThat(logged)
                .containsEntry("warden.jwt.secret", SensitiveDataRedactor.REDACTED)
                .containsEntry("warden.routes[0].password", SensitiveDataRedactor.REDACTED)
                .containsEntry("warden.seed.user-password", SensitiveDataRedactor.REDACTED)
                .containsEntry("warden.seed.admin-password", SensitiveDataRedactor.REDACTED)
                .containsEntry("warden.jwt.access-token-ttl", Duration.ofMinutes(5))
                .containsEntry("warden.routes[0].path", "/pw")
                .containsEntry("warden.rate-limit.max-requests", 3);
        assertThat(logged.toString()).doesNotContain("Password123").doesNotContain("logger-test-secret");
    }
}
