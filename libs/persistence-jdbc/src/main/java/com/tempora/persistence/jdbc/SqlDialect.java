package com.tempora.persistence.jdbc;

import com.tempora.versioning.error.PersistenceUnavailableException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import javax.sql.DataSource;

/**
 * The few statements that differ between the supported databases.
 */
public enum SqlDialect {

    POSTGRESQL("PostgreSQL", "SELECT nextval('tempora_version_seq')"),

    /** H2 in PostgreSQL compatibility mode; used by tests and embedded deployments. */
    H2("H2", "SELECT NEXT VALUE FOR tempora_version_seq");

    private final String productName;
    private final String nextVersionSeqSql;

    SqlDialect(String productName, String nextVersionSeqSql) {
        this.productName = productName;
        this.nextVersionSeqSql = nextVersionSeqSql;
    }

    public String productName() {
        return productName;
    }

    public String nextVersionSeqSql() {
        return nextVersionSeqSql;
    }

    /**
     * Picks the dialect for a database product name as reported by JDBC metadata.
     *
     * @throws IllegalArgumentException if the product is not supported
     */
    public static SqlDialect forProduct(String databaseProductName) {
        String normalized = databaseProductName == null ? "" : databaseProductName.toLowerCase(Locale.ROOT);
        for (SqlDialect dialect : values()) {
            if (normalized.contains(dialect.productName.toLowerCase(Locale.ROOT))) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("Unsupported database: " + databaseProductName);
    }

    /** Connects once to read the product name. */
    public static SqlDialect detect(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return forProduct(connection.getMetaData().getDatabaseProductName());
        } catch (SQLException e) {
            throw new PersistenceUnavailableException("Cannot detect database dialect: " + e.getMessage(), e);
        }
    }
}
