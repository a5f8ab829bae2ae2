/**
 * JDBC persistence for the credential store and the refresh-token registry.
 *
 * <p>{@link com.warden.database.JdbcCredentialRepository} and {@link
 * com.warden.database.JdbcRefreshTokenRepository} implement the ports declared in {@code
 * com.warden.security}. The schema lives under {@code db/migration/warden} and is applied by
 * Flyway; see {@link com.warden.database.CredentialSchema}.
 *
 * <p>Every {@link org.springframework.dao.DataAccessException} leaves this package as a {@link
 * com.warden.security.CredentialStoreException}, so callers never mistake a storage outage for a
 * credential rejection.
 */
package com.warden.database;
