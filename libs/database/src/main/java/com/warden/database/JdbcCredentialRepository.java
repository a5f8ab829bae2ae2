package com.warden.database;

import static com.warden.database.StorageFailures.translate;

import com.warden.security.CredentialRepository;
import com.warden.security.CredentialStoreException;
import com.warden.security.DuplicateEmailException;
import com.warden.security.PrivilegeLevel;
import com.warden.security.User;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Objects;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link CredentialRepository} over the {@code users} table.
 *
 * <p>Each statement runs in auto-commit unless the caller supplies a transaction. Emails are
 * stored already normalised by {@link com.warden.security.CredentialStore}; the unique constraint
 * on {@code email} is what rejects duplicates, so concurrent registrations cannot both succeed.
 */
public class JdbcCredentialRepository implements CredentialRepository {

    private static final String COLUMNS =
            "user_id, email, secret_hash, api_key_hash, privilege_level, created_at, disabled";

    private static final RowMapper<User> USER_ROW_MAPPER = JdbcCredentialRepository::mapUser;

    private final JdbcTemplate jdbc;

    public JdbcCredentialRepository(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    }

    @Override
    public void insert(User user) {
        try {
            jdbc.update(
                    "INSERT INTO users (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
                    user.userId(),
                    user.email(),
                    user.secretHash(),
                    user.apiKeyHash(),
                    user.privilege().value(),
                    Timestamp.from(user.createdAt()),
                    user.disabled());
        } catch (DuplicateKeyException e) {
            throw new DuplicateEmailException(user.email());
        } catch (DataAccessException e) {
            throw new CredentialStoreException("Credential storage failed during insert", e);
        }
    }

    @Override
    public Optional<User> findById(String userId) {
        return findOne("findById", "user_id", userId);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return findOne("findByEmail", "email", email);
    }

    @Override
    public Optional<User> findByApiKeyHash(String apiKeyHash) {
        return findOne("findByApiKeyHash", "api_key_hash", apiKeyHash);
    }

    @Override
    public boolean updateApiKeyHash(String userId, String apiKeyHash) {
        return updateColumn("updateApiKeyHash", "api_key_hash", apiKeyHash, userId);
    }

    @Override
    public boolean updatePrivilege(String userId, PrivilegeLevel privilege) {
        return updateColumn("updatePrivilege", "privilege_level", privilege.value(), userId);
    }

    @Override
    public boolean updateSecretHash(String userId, String secretHash) {
        return updateColumn("updateSecretHash", "secret_hash", secretHash, userId);
    }

    @Override
    public boolean disable(String userId) {
        return updateColumn("disable", "disabled", Boolean.TRUE, userId);
    }

    private Optional<User> findOne(String operation, String column, String value) {
        return translate(operation, () -> jdbc.query(
                "SELECT " + COLUMNS + " FROM users WHERE " + column + " = ?",
                USER_ROW_MAPPER,
                value).stream().findFirst());
    }

    // column names are constants from this class, never caller input
    private boolean updateColumn(String operation, String column, Object value, String userId) {
        return translate(operation, () -> jdbc.update(
                "UPDATE users SET " + column + " = ? WHERE user_id = ?", value, userId)) == 1;
    }

    private static User mapUser(ResultSet rs, int rowNum) throws SQLException {
        return new User(
                rs.getString("user_id"),
                rs.getString("email"),
                rs.getString("secret_hash"),
                rs.getString("api_key_hash"),
                PrivilegeLevel.of(rs.getInt("privilege_level")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getBoolean("disabled"));
    }
}
