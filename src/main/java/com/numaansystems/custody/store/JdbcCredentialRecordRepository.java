package com.numaansystems.custody.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Implementation of CredentialRecordRepository using JDBC.
 *
 * <p>Selected with {@code custody.store.type=jdbc} (the default). Timestamps
 * are stored as epoch milliseconds and scopes as a space-delimited string, so
 * the same schema works on PostgreSQL and H2.</p>
 *
 * <h2>Database Schema</h2>
 * <p>Created by {@code schema.sql} on startup:</p>
 * <pre>
 * CREATE TABLE IF NOT EXISTS oauth_tokens (
 *     user_id           VARCHAR(255)  NOT NULL PRIMARY KEY,
 *     access_token_enc  VARCHAR(8192) NOT NULL,
 *     refresh_token_enc VARCHAR(8192),
 *     expires_at        BIGINT,
 *     scopes            VARCHAR(2048),
 *     created_at        BIGINT        NOT NULL,
 *     updated_at        BIGINT        NOT NULL
 * );
 * </pre>
 *
 * <h2>Last write wins</h2>
 * <p>{@link #save(CredentialRecord)} first tries a conditional UPDATE that
 * only matches when the stored {@code updated_at} is not newer than the
 * incoming one, then falls back to INSERT. A concurrent insert for the same
 * user surfaces as a duplicate key and is retried as the conditional UPDATE.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class JdbcCredentialRecordRepository implements CredentialRecordRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcCredentialRecordRepository.class);

    private static final String SELECT_SQL = """
            SELECT user_id, access_token_enc, refresh_token_enc, expires_at, scopes, created_at, updated_at
            FROM oauth_tokens
            WHERE user_id = ?
            """;

    private static final String UPDATE_SQL = """
            UPDATE oauth_tokens
            SET access_token_enc = ?, refresh_token_enc = ?, expires_at = ?, scopes = ?, updated_at = ?
            WHERE user_id = ? AND updated_at <= ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO oauth_tokens
                (user_id, access_token_enc, refresh_token_enc, expires_at, scopes, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String DELETE_SQL = "DELETE FROM oauth_tokens WHERE user_id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<CredentialRecord> rowMapper = this::mapRow;

    /**
     * Constructor injection of JdbcTemplate.
     *
     * @param jdbcTemplate Spring JDBC template for database access
     */
    public JdbcCredentialRecordRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<CredentialRecord> find(String userId) {
        List<CredentialRecord> rows = jdbcTemplate.query(SELECT_SQL, rowMapper, userId);
        return rows.stream().findFirst();
    }

    @Override
    public boolean save(CredentialRecord record) {
        if (update(record)) {
            return true;
        }
        try {
            jdbcTemplate.update(INSERT_SQL,
                    record.userId(),
                    record.accessTokenCiphertext(),
                    record.refreshTokenCiphertext(),
                    toMillis(record.expiresAt()),
                    joinScopes(record.scopes()),
                    record.createdAt().toEpochMilli(),
                    record.updatedAt().toEpochMilli());
            logger.debug("Inserted credential record for user: {}", record.userId());
            return true;
        } catch (DuplicateKeyException e) {
            // row appeared since the update attempt; it may be newer than ours
            boolean written = update(record);
            if (!written) {
                logger.info("Ignored stale credential write for user: {}", record.userId());
            }
            return written;
        }
    }

    @Override
    public boolean delete(String userId) {
        int deleted = jdbcTemplate.update(DELETE_SQL, userId);
        logger.debug("Deleted {} credential record(s) for user: {}", deleted, userId);
        return deleted > 0;
    }

    private boolean update(CredentialRecord record) {
        long updatedAt = record.updatedAt().toEpochMilli();
        int updated = jdbcTemplate.update(UPDATE_SQL,
                record.accessTokenCiphertext(),
                record.refreshTokenCiphertext(),
                toMillis(record.expiresAt()),
                joinScopes(record.scopes()),
                updatedAt,
                record.userId(),
                updatedAt);
        return updated > 0;
    }

    private CredentialRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        long expiresAt = rs.getLong("expires_at");
        Instant expiry = rs.wasNull() ? null : Instant.ofEpochMilli(expiresAt);
        return new CredentialRecord(
                rs.getString("user_id"),
                rs.getString("access_token_enc"),
                rs.getString("refresh_token_enc"),
                expiry,
                splitScopes(rs.getString("scopes")),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at")));
    }

    private static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static String joinScopes(List<String> scopes) {
        return String.join(" ", scopes);
    }

    private static List<String> splitScopes(String scopes) {
        if (scopes == null || scopes.isBlank()) {
            return List.of();
        }
        return Arrays.asList(scopes.trim().split("\\s+"));
    }
}
