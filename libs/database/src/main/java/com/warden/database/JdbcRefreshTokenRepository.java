package com.warden.database;

import static com.warden.database.StorageFailures.translate;

import com.warden.security.CredentialStoreException;
import com.warden.security.RefreshTokenRecord;
import com.warden.security.RefreshTokenRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link RefreshTokenRepository} over the {@code refresh_tokens} table.
 *
 * <p>{@link #rotate} revokes the old row with a conditional update and inserts the replacement in
 * the same transaction. The update only matches a row that is still unrevoked and unexpired, so
 * when several requests race on one token the database lets exactly one of them change the row.
 */
public class JdbcRefreshTokenRepository implements RefreshTokenRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRefreshTokenRepository.class);

    private static final RowMapper<RefreshTokenRecord> RECORD_ROW_MAPPER =
            JdbcRefreshTokenRepository::mapRecord;

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public JdbcRefreshTokenRepository(JdbcTemplate jdbc, TransactionTemplate transactions) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.transactions = Objects.requireNonNull(transactions, "transactions");
    }

    @Override
    public void save(RefreshTokenRecord record) {
        translate("save", () -> insert(record));
    }

    @Override
    public Optional<RefreshTokenRecord> findById(String tokenId) {
        return translate("findById", () -> jdbc.query(
                "SELECT token_id, user_id, issued_at, expires_at, revoked_at"
                        + " FROM refresh_tokens WHERE token_id = ?",
                RECORD_ROW_MAPPER,
                tokenId).stream().findFirst());
    }

    @Override
    public boolean rotate(String oldTokenId, RefreshTokenRecord replacement, Instant now) {
        try {
            Boolean rotated = transactions.execute(status -> {
                int revoked = jdbc.update(
                        "UPDATE refresh_tokens SET revoked_at = ?"
                                + " WHERE token_id = ? AND revoked_at IS NULL AND expires_at > ?",
                        Timestamp.from(now), oldTokenId, Timestamp.from(now));
                if (revoked != 1) {
                    return false;
                }
                insert(replacement);
                return true;
            });
            return Boolean.TRUE.equals(rotated);
        } catch (ConcurrencyFailureException e) {
            log.debug("Rotation of refresh token {} lost to a concurrent update", oldTokenId);
            return false;
        } catch (DataAccessException | TransactionException e) {
            throw new CredentialStoreException("Credential storage failed during rotate", e);
        }
    }

    @Override
    public boolean revoke(String tokenId, Instant now) {
        return translate("revoke", () -> jdbc.update(
                "UPDATE refresh_tokens SET revoked_at = ? WHERE token_id = ? AND revoked_at IS NULL",
                Timestamp.from(now), tokenId)) == 1;
    }

    @Override
    public int revokeAllForUser(String userId, Instant now) {
        return translate("revokeAllForUser", () -> jdbc.update(
                "UPDATE refresh_tokens SET revoked_at = ? WHERE user_id = ? AND revoked_at IS NULL",
                Timestamp.from(now), userId));
    }

    private int insert(RefreshTokenRecord record) {
        return jdbc.update(
                "INSERT INTO refresh_tokens (token_id, user_id, issued_at, expires_at, revoked_at)"
                        + " VALUES (?, ?, ?, ?, ?)",
                record.tokenId(),
                record.userId(),
                Timestamp.from(record.issuedAt()),
                Timestamp.from(record.expiresAt()),
                record.revokedAt() == null ? null : Timestamp.from(record.revokedAt()));
    }

    private static RefreshTokenRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        Timestamp revokedAt = rs.getTimestamp("revoked_at");
        return new RefreshTokenRecord(
                rs.getString("token_id"),
                rs.getString("user_id"),
                rs.getTimestamp("issued_at").toInstant(),
                rs.getTimestamp("expires_at").toInstant(),
                revokedAt == null ? null : revokedAt.toInstant());
    }
}
