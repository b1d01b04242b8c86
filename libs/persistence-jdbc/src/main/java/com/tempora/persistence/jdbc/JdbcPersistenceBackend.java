package com.tempora.persistence.jdbc;

import com.tempora.versioning.spi.BackendHealth;
import com.tempora.versioning.spi.PersistenceBackend;
import com.tempora.versioning.spi.TransactionWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * {@link PersistenceBackend} on a relational database (PostgreSQL in production, H2 in tests).
 *
 * <p>Each transaction borrows one pooled connection, runs at READ COMMITTED and commits or rolls
 * back as a unit. Concurrent writers to one identity are serialized by the compare-and-set on
 * {@code tempora_current_version}; the loser sees a {@link
 * com.tempora.versioning.error.ConcurrencyConflictException} and its transaction is rolled back.
 * The schema must already be migrated, see {@link com.tempora.persistence.jdbc.migration.SchemaMigrator}.
 */
public class JdbcPersistenceBackend implements PersistenceBackend {

    private static final Logger log = LoggerFactory.getLogger(JdbcPersistenceBackend.class);

    public static final String NAME = "jdbc";

    private static final int PROBE_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final SqlDialect dialect;

    public JdbcPersistenceBackend(DataSource dataSource) {
        this(dataSource, SqlDialect.detect(dataSource));
    }

    public JdbcPersistenceBackend(DataSource dataSource, SqlDialect dialect) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        log.info("JDBC persistence backend ready (dialect={})", dialect);
    }

    @Override
    public <T> T inTransaction(TransactionWork<T> work) {
        return run(work, false);
    }

    @Override
    public <T> T read(TransactionWork<T> work) {
        return run(work, true);
    }

    @Override
    public BackendHealth probe() {
        long started = System.nanoTime();
        try (Connection connection = dataSource.getConnection()) {
            Duration latency = Duration.ofNanos(System.nanoTime() - started);
            if (connection.isValid(PROBE_TIMEOUT_SECONDS)) {
                return BackendHealth.available(NAME, latency);
            }
            return BackendHealth.unavailable(NAME, "Connection failed validation", latency);
        } catch (SQLException e) {
            log.warn("Persistence probe failed: {}", e.getMessage());
            return BackendHealth.unavailable(NAME, e.getMessage(), Duration.ofNanos(System.nanoTime() - started));
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    private <T> T run(TransactionWork<T> work, boolean readOnly) {
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            connection.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
            connection.setReadOnly(readOnly);
            try {
                T result = work.run(new JdbcStoreTransaction(connection, dialect));
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate(readOnly ? "Read transaction" : "Transaction", e);
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            log.warn("Rollback failed after {}: {}", cause.getClass().getSimpleName(), rollbackFailure.getMessage());
            cause.addSuppressed(rollbackFailure);
        }
    }
}
