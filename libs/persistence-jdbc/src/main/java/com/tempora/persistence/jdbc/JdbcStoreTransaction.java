package com.tempora.persistence.jdbc;

import com.tempora.versioning.EntityTypeStatistics;
import com.tempora.versioning.error.ConcurrencyConflictException;
import com.tempora.versioning.identity.Identity;
import com.tempora.versioning.identity.IdentityKey;
import com.tempora.versioning.payload.Payload;
import com.tempora.versioning.payload.PayloadDigest;
import com.tempora.versioning.spi.StoreTransaction;
import com.tempora.versioning.version.Version;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link StoreTransaction} over one JDBC connection with auto-commit off. The owning
 * {@link JdbcPersistenceBackend} commits or rolls back.
 */
final class JdbcStoreTransaction implements StoreTransaction {

    private static final String IDENTITY_COLUMNS =
            "identity_key, entity_type, tenant_id, business_key, created_at, source_tag";

    private static final String VERSION_COLUMNS =
            "v.identity_key, v.version_seq, v.effective_start, v.effective_end, v.payload_digest, v.payload, "
                    + "v.actor, v.source_tag";

    private static final String SELECT_IDENTITY_BY_KEY =
            "SELECT " + IDENTITY_COLUMNS + " FROM tempora_identity WHERE identity_key = ?";

    private static final String SELECT_IDENTITY_BY_NATURAL_KEY =
            "SELECT " + IDENTITY_COLUMNS + " FROM tempora_identity "
                    + "WHERE tenant_id = ? AND entity_type = ? AND business_key = ?";

    private static final String INSERT_IDENTITY =
            "INSERT INTO tempora_identity (" + IDENTITY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)";

    private static final String SELECT_IDENTITIES =
            "SELECT " + IDENTITY_COLUMNS + " FROM tempora_identity WHERE tenant_id = ? "
                    + "ORDER BY entity_type, business_key";

    private static final String SELECT_IDENTITIES_OF_TYPE =
            "SELECT " + IDENTITY_COLUMNS + " FROM tempora_identity WHERE tenant_id = ? AND entity_type = ? "
                    + "ORDER BY business_key";

    private static final String SELECT_CURRENT =
            "SELECT " + VERSION_COLUMNS + " FROM tempora_current_version c "
                    + "JOIN tempora_version v ON v.identity_key = c.identity_key AND v.version_seq = c.version_seq "
                    + "WHERE c.identity_key = ?";

    private static final String SELECT_AS_OF =
            "SELECT " + VERSION_COLUMNS + " FROM tempora_version v "
                    + "WHERE v.identity_key = ? AND v.effective_start <= ? "
                    + "AND (v.effective_end IS NULL OR v.effective_end > ?) "
                    + "ORDER BY v.version_seq DESC";

    private static final String SELECT_HISTORY =
            "SELECT " + VERSION_COLUMNS + " FROM tempora_version v WHERE v.identity_key = ? ORDER BY v.version_seq";

    private static final String INSERT_CURRENT =
            "INSERT INTO tempora_current_version (identity_key, version_seq) VALUES (?, ?)";

    private static final String SWAP_CURRENT =
            "UPDATE tempora_current_version SET version_seq = ? WHERE identity_key = ? AND version_seq = ?";

    private static final String CLOSE_VERSION =
            "UPDATE tempora_version SET effective_end = ? "
                    + "WHERE identity_key = ? AND version_seq = ? AND effective_end IS NULL";

    private static final String INSERT_VERSION =
            "INSERT INTO tempora_version (identity_key, version_seq, effective_start, effective_end, "
                    + "payload_digest, payload, actor, source_tag) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_STATISTICS =
            "SELECT i.entity_type, COUNT(DISTINCT i.identity_key) AS identity_count, "
                    + "MAX(i.created_at) AS last_created_at, COUNT(v.version_seq) AS total_versions, "
                    + "SUM(CASE WHEN v.version_seq IS NOT NULL AND v.effective_end IS NULL THEN 1 ELSE 0 END) "
                    + "AS open_versions, "
                    + "SUM(CASE WHEN v.effective_start >= ? THEN 1 ELSE 0 END) AS recent_versions "
                    + "FROM tempora_identity i LEFT JOIN tempora_version v ON v.identity_key = i.identity_key "
                    + "WHERE i.tenant_id = ? GROUP BY i.entity_type ORDER BY i.entity_type";

    private final Connection connection;
    private final SqlDialect dialect;

    JdbcStoreTransaction(Connection connection, SqlDialect dialect) {
        this.connection = connection;
        this.dialect = dialect;
    }

    @Override
    public Optional<Identity> findIdentity(IdentityKey key) {
        return execute("Identity lookup", () -> {
            try (PreparedStatement ps = connection.prepareStatement(SELECT_IDENTITY_BY_KEY)) {
                ps.setString(1, key.hex());
                return singleIdentity(ps);
            }
        });
    }

    @Override
    public Optional<Identity> findIdentity(String tenantId, String entityType, String businessKey) {
        return execute("Identity lookup", () -> {
            try (PreparedStatement ps = connection.prepareStatement(SELECT_IDENTITY_BY_NATURAL_KEY)) {
                ps.setString(1, tenantId);
                ps.setString(2, entityType);
                ps.setString(3, businessKey);
                return singleIdentity(ps);
            }
        });
    }

    @Override
    public boolean insertIdentityIfAbsent(Identity identity) {
        return execute("Identity insert", () -> {
            Savepoint savepoint = connection.setSavepoint();
            try (PreparedStatement ps = connection.prepareStatement(INSERT_IDENTITY)) {
                ps.setString(1, identity.identityKey().hex());
                ps.setString(2, identity.entityType());
                ps.setString(3, identity.tenantId());
                ps.setString(4, identity.businessKey());
                ps.setObject(5, toTimestamp(identity.createdAt()));
                ps.setString(6, identity.sourceTag());
                ps.executeUpdate();
            } catch (SQLException e) {
                if (SqlErrors.isUniqueViolation(e)) {
                    connection.rollback(savepoint);
                    return false;
                }
                throw e;
            }
            connection.releaseSavepoint(savepoint);
            return true;
        });
    }

    @Override
    public List<Identity> listIdentities(String tenantId, String entityType) {
        return execute("Identity listing", () -> {
            String sql = entityType == null ? SELECT_IDENTITIES : SELECT_IDENTITIES_OF_TYPE;
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                ps.setString(1, tenantId);
                if (entityType != null) {
                    ps.setString(2, entityType);
                }
                List<Identity> identities = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        identities.add(mapIdentity(rs));
                    }
                }
                return identities;
            }
        });
    }

    @Override
    public Optional<Version> currentVersion(IdentityKey key) {
        return execute("Current version read", () -> {
            try (PreparedStatement ps = connection.prepareStatement(SELECT_CURRENT)) {
                ps.setString(1, key.hex());
                return firstVersion(ps);
            }
        });
    }

    @Override
    public Optional<Version> versionAsOf(IdentityKey key, Instant at) {
        return execute("As-of read", () -> {
            try (PreparedStatement ps = connection.prepareStatement(SELECT_AS_OF)) {
                OffsetDateTime timestamp = toTimestamp(at);
                ps.setString(1, key.hex());
                ps.setObject(2, timestamp);
                ps.setObject(3, timestamp);
                return firstVersion(ps);
            }
        });
    }

    @Override
    public List<Version> history(IdentityKey key) {
        return execute("History read", () -> {
            try (PreparedStatement ps = connection.prepareStatement(SELECT_HISTORY)) {
                ps.setString(1, key.hex());
                List<Version> versions = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        versions.add(mapVersion(rs));
                    }
                }
                return versions;
            }
        });
    }

    @Override
    public long nextVersionSeq() {
        return execute("Sequence draw", () -> {
            try (PreparedStatement ps = connection.prepareStatement(dialect.nextVersionSeqSql());
                    ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Sequence tempora_version_seq returned no value");
                }
                return rs.getLong(1);
            }
        });
    }

    @Override
    public void advanceCurrent(IdentityKey key, Long expectedSeq, long newSeq) {
        execute("Current slot swap", () -> {
            if (expectedSeq == null) {
                insertCurrentSlot(key, newSeq);
                return null;
            }
            try (PreparedStatement ps = connection.prepareStatement(SWAP_CURRENT)) {
                ps.setLong(1, newSeq);
                ps.setString(2, key.hex());
                ps.setLong(3, expectedSeq);
                if (ps.executeUpdate() != 1) {
                    throw new ConcurrencyConflictException(
                            "Current version of " + key + " is no longer " + expectedSeq);
                }
            }
            return null;
        });
    }

    @Override
    public void closeVersion(IdentityKey key, long versionSeq, Instant effectiveEnd) {
        execute("Version close", () -> {
            try (PreparedStatement ps = connection.prepareStatement(CLOSE_VERSION)) {
                ps.setObject(1, toTimestamp(effectiveEnd));
                ps.setString(2, key.hex());
                ps.setLong(3, versionSeq);
                if (ps.executeUpdate() != 1) {
                    throw new ConcurrencyConflictException(
                            "Version " + versionSeq + " of " + key + " is no longer open");
                }
            }
            return null;
        });
    }

    @Override
    public void insertVersion(Version version) {
        execute("Version insert", () -> {
            try (PreparedStatement ps = connection.prepareStatement(INSERT_VERSION)) {
                ps.setString(1, version.identityKey().hex());
                ps.setLong(2, version.versionSeq());
                ps.setObject(3, toTimestamp(version.effectiveStart()));
                if (version.effectiveEnd() == null) {
                    ps.setNull(4, Types.TIMESTAMP_WITH_TIMEZONE);
                } else {
                    ps.setObject(4, toTimestamp(version.effectiveEnd()));
                }
                ps.setString(5, version.payloadDigest().hex());
                ps.setString(6, version.payload().canonicalJson());
                ps.setString(7, version.actor());
                ps.setString(8, version.sourceTag());
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<EntityTypeStatistics> statistics(String tenantId, Instant since) {
        return execute("Statistics query", () -> {
            try (PreparedStatement ps = connection.prepareStatement(SELECT_STATISTICS)) {
                ps.setObject(1, toTimestamp(since));
                ps.setString(2, tenantId);
                List<EntityTypeStatistics> rows = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        rows.add(new EntityTypeStatistics(
                                rs.getString("entity_type"),
                                rs.getLong("identity_count"),
                                toInstant(rs.getObject("last_created_at", OffsetDateTime.class)),
                                rs.getLong("total_versions"),
                                rs.getLong("open_versions"),
                                rs.getLong("recent_versions")));
                    }
                }
                return rows;
            }
        });
    }

    private void insertCurrentSlot(IdentityKey key, long newSeq) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(INSERT_CURRENT)) {
            ps.setString(1, key.hex());
            ps.setLong(2, newSeq);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (SqlErrors.isUniqueViolation(e)) {
                throw new ConcurrencyConflictException("Current version of " + key + " was set concurrently", e);
            }
            throw e;
        }
    }

    private Optional<Identity> singleIdentity(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(mapIdentity(rs)) : Optional.empty();
        }
    }

    private Optional<Version> firstVersion(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(mapVersion(rs)) : Optional.empty();
        }
    }

    private static Identity mapIdentity(ResultSet rs) throws SQLException {
        return new Identity(
                IdentityKey.of(rs.getString("identity_key")),
                rs.getString("entity_type"),
                rs.getString("tenant_id"),
                rs.getString("business_key"),
                toInstant(rs.getObject("created_at", OffsetDateTime.class)),
                rs.getString("source_tag"));
    }

    private static Version mapVersion(ResultSet rs) throws SQLException {
        return new Version(
                IdentityKey.of(rs.getString("identity_key")),
                rs.getLong("version_seq"),
                toInstant(rs.getObject("effective_start", OffsetDateTime.class)),
                toInstant(rs.getObject("effective_end", OffsetDateTime.class)),
                PayloadDigest.of(rs.getString("payload_digest")),
                Payload.parse(rs.getString("payload")),
                rs.getString("actor"),
                rs.getString("source_tag"));
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static <T> T execute(String operation, SqlCall<T> call) {
        try {
            return call.run();
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, e);
        }
    }

    @FunctionalInterface
    private interface SqlCall<T> {
        T run() throws SQLException;
    }
}
