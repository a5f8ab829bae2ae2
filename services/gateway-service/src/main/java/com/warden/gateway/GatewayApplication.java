package com.warden.gateway;

import com.warden.gateway.config.WardenProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Warden gateway: every inbound HTTP request passes through the {@link
 * com.warden.security.RequestMediator} before it reaches a controller.
 *
 * <p>Key features configured by default:
 *
 * <ul>
 *   <li>Rate, credential and privilege checks in one servlet filter
 *   <li>JWT login, refresh rotation, logout and API-key issuance under {@code /api/auth}
 *   <li>Credential storage over JDBC, schema applied by Flyway at startup
 *   <li>Correlation ID propagation and RFC 7807 error bodies
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(WardenProperties.class)
public class GatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(GatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
        log.info("Warden gateway started successfully");
    }
}
