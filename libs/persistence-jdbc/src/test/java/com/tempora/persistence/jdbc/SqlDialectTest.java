package com.tempora.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SqlDialect")
class SqlDialectTest {

    @Test
    @DisplayName("matches product names case-insensitively")
    void forProduct() {
        assertThat(SqlDialect.forProduct("PostgreSQL")).isEqualTo(SqlDialect.POSTGRESQL);
        assertThat(SqlDialect.forProduct("H2")).isEqualTo(SqlDialect.H2);
        assertThat(SqlDialect.forProduct("postgresql 16")).isEqualTo(SqlDialect.POSTGRESQL);
    }

    @Test
    @DisplayName("rejects unsupported databases")
    void unsupported() {
        assertThatThrownBy(() -> SqlDialect.forProduct("MySQL"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MySQL");
    }

    @Test
    @DisplayName("detects H2 from a live connection")
    void detect() {
        try (HikariDataSource dataSource = H2Databases.empty()) {
            assertThat(SqlDialect.detect(dataSource)).isEqualTo(SqlDialect.H2);
        }
    }

    @Test
    @DisplayName("each dialect draws from the version sequence")
    void sequenceStatements() {
        assertThat(SqlDialect.POSTGRESQL.nextVersionSeqSql()).contains("nextval('tempora_version_seq')");
        assertThat(SqlDialect.H2.nextVersionSeqSql()).contains("NEXT VALUE FOR tempora_version_seq");
    }
}
