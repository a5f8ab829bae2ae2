package com.warden.database;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Location of the credential schema scripts and a way to apply them outside Spring Boot.
 *
 * <p>The gateway lets Spring Boot's Flyway auto-configuration run the scripts at startup, pointed
 * at {@link #LOCATION}. Tests and tools without a Spring context call {@link #migrate(DataSource)}.
 */
public final class CredentialSchema {

    private static final Logger log = LoggerFactory.getLogger(CredentialSchema.class);

    /** Flyway location of the versioned scripts shipped in this module. */
    public static final String LOCATION = "classpath:db/migration/warden";

    private CredentialSchema() {
        // utility class
    }

    public static Flyway flyway(DataSource dataSource) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(LOCATION)
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }

    /**
     * Applies any pending scripts.
     *
     * @return number of scripts applied by this call
     */
    public static int migrate(DataSource dataSource) {
        MigrateResult result = flyway(dataSource).migrate();
        log.info("Credential schema at version {} ({} migration(s) applied)",
                result.targetSchemaVersion, result.migrationsExecuted);
        return result.migrationsExecuted;
    }
}
