package com.tempora.persistence.jdbc;

import com.tempora.versioning.error.ConcurrencyConflictException;
import com.tempora.versioning.error.PersistenceUnavailableException;
import com.tempora.versioning.error.VersionStoreException;

import java.sql.SQLException;
import java.util.Set;

/**
 * Maps driver exceptions onto the store's error taxonomy.
 *
 * <p>Serialization failures, deadlocks, lock timeouts and unique-key violations mean another
 * transaction got there first and the write may be retried. Anything else means the database
 * could not do its job.
 */
final class SqlErrors {

    static final String UNIQUE_VIOLATION = "23505";

    private static final Set<String> CONFLICT_STATES = Set.of(
            "40001", // serialization_failure
            "40P01", // deadlock_detected (PostgreSQL)
            UNIQUE_VIOLATION);

    // H2 lock timeout, reported with SQLState HYT00
    private static final int H2_LOCK_TIMEOUT = 50200;

    private SqlErrors() {
    }

    static boolean isUniqueViolation(SQLException e) {
        return UNIQUE_VIOLATION.equals(e.getSQLState());
    }

    static boolean isConflict(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            String state = current.getSQLState();
            if ((state != null && CONFLICT_STATES.contains(state)) || current.getErrorCode() == H2_LOCK_TIMEOUT) {
                return true;
            }
        }
        return false;
    }

    static VersionStoreException translate(String operation, SQLException e) {
        if (isConflict(e)) {
            return new ConcurrencyConflictException(
                    operation + " conflicted with a concurrent transaction (SQLState " + e.getSQLState() + ")", e);
        }
        return new PersistenceUnavailableException(
                operation + " failed (SQLState " + e.getSQLState() + "): " + e.getMessage(), e);
    }
}
