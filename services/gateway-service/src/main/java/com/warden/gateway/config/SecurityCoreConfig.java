package com.warden.gateway.config;

import com.warden.database.CredentialSchema;
import com.warden.database.JdbcCredentialRepository;
import com.warden.database.JdbcRefreshTokenRepository;
import com.warden.gateway.infrastructure.metrics.AuthorizationMetrics;
import com.warden.observability.MetricFactory;
import com.warden.observability.SpanHelper;
import com.warden.security.CredentialRepository;
import com.warden.security.CredentialStore;
import com.warden.security.RateLimiter;
import com.warden.security.RefreshTokenRepository;
import com.warden.security.RequestMediator;
import com.warden.security.RouteTable;
import com.warden.security.TokenService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.flyway.FlywayConfigurationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the framework-free components from {@code warden-security} and {@code warden-database}
 * into the Spring context. Each component receives its configuration record explicitly.
 */
@Configuration
public class SecurityCoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordEncoder passwordEncoder(WardenProperties properties) {
        return new BCryptPasswordEncoder(properties.bcryptStrength());
    }

    @Bean
    public FlywayConfigurationCustomizer credentialSchemaLocation() {
        return configuration -> configuration.locations(CredentialSchema.LOCATION);
    }

    @Bean
    public CredentialRepository credentialRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcCredentialRepository(jdbcTemplate);
    }

    @Bean
    public RefreshTokenRepository refreshTokenRepository(
            JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        return new JdbcRefreshTokenRepository(jdbcTemplate, new TransactionTemplate(transactionManager));
    }

    @Bean
    public CredentialStore credentialStore(
            CredentialRepository credentialRepository, PasswordEncoder passwordEncoder, Clock clock) {
        return new CredentialStore(credentialRepository, passwordEncoder, clock);
    }

    @Bean
    public TokenService tokenService(
            WardenProperties properties,
            RefreshTokenRepository refreshTokenRepository,
            CredentialStore credentialStore,
            Clock clock) {
        return new TokenService(properties.tokenConfig(), refreshTokenRepository, credentialStore, clock);
    }

    @Bean
    public RateLimiter rateLimiter(WardenProperties properties, Clock clock) {
        return new RateLimiter(properties.rateLimit().toConfig(), clock);
    }

    @Bean
    public RouteTable routeTable(WardenProperties properties) {
        return properties.routeTable();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, WardenProperties properties) {
        return new MetricFactory(meterRegistry, properties.serviceName());
    }

    /** Uses the context's {@link OpenTelemetry} when one is configured, else the global instance. */
    @Bean
    public SpanHelper spanHelper(ObjectProvider<OpenTelemetry> openTelemetry) {
        return new SpanHelper(openTelemetry.getIfAvailable(GlobalOpenTelemetry::get).getTracer("com.warden.gateway"));
    }

    @Bean
    public RequestMediator requestMediator(
            RouteTable routeTable,
            RateLimiter rateLimiter,
            TokenService tokenService,
            CredentialStore credentialStore,
            WardenProperties properties,
            AuthorizationMetrics authorizationMetrics) {
        return new RequestMediator(
                routeTable,
                rateLimiter,
                tokenService,
                credentialStore,
                properties.clientKeyStrategy(),
                authorizationMetrics);
    }
}
