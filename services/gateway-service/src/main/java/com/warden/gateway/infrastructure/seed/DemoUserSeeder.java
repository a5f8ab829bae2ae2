package com.warden.gateway.infrastructure.seed;

import com.warden.gateway.config.WardenProperties;
import com.warden.security.CredentialStore;
import com.warden.security.DuplicateEmailException;
import com.warden.security.PrivilegeLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Creates the demo accounts {@value #DEMO_USER} (USER) and {@value #DEMO_ADMIN} (ADMIN) when
 * {@code warden.seed.enabled=true}. Accounts that already exist are left untouched.
 */
@Component
@ConditionalOnProperty(prefix = "warden.seed", name = "enabled", havingValue = "true")
public class DemoUserSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoUserSeeder.class);

    public static final String DEMO_USER = "user@example.com";
    public static final String DEMO_ADMIN = "admin@example.com";

    private final CredentialStore credentialStore;
    private final WardenProperties.Seed seed;

    public DemoUserSeeder(CredentialStore credentialStore, WardenProperties properties) {
        this.credentialStore = credentialStore;
        this.seed = properties.seed();
    }

    @Override
    public void run(ApplicationArguments args) {
        seedUser(DEMO_USER, seed.userPassword(), PrivilegeLevel.USER);
        seedUser(DEMO_ADMIN, seed.adminPassword(), PrivilegeLevel.ADMIN);
    }

    private void seedUser(String email, String password, PrivilegeLevel privilege) {
        if (password == null || password.isBlank()) {
            log.warn("Skipping demo user {}: no password configured", email);
            return;
        }
        try {
            credentialStore.createUser(email, password, privilege);
            log.info("Seeded demo user {} at {}", email, privilege);
        } catch (DuplicateEmailException e) {
            log.debug("Demo user {} already present", email);
        }
    }
}
