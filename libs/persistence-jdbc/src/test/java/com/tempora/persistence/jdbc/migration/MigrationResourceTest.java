package com.tempora.persistence.jdbc.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Checks that the migration scripts are packaged where Flyway looks for them and declare the
 * constraints the store relies on.
 */
@DisplayName("Migration SQL Resource Verification")
class MigrationResourceTest {

    private static final String V1 = "db/migration/tempora/V1__create_identity_tables.sql";
    private static final String V2 = "db/migration/tempora/V2__create_version_tables.sql";

    @Nested
    @DisplayName("V1 identity tables")
    class IdentityTables {

        @Test
        @DisplayName("V1__create_identity_tables.sql is on the classpath")
        void onClasspath() {
            try (InputStream is = getClass().getClassLoader().getResourceAsStream(V1)) {
                assertThat(is).as("V1 must be on the classpath").isNotNull();
            } catch (IOException e) {
                throw new AssertionError("Failed to read migration resource", e);
            }
        }

        @Test
        @DisplayName("identity natural key is unique")
        void naturalKeyUnique() throws IOException {
            String sql = readClasspathResource(V1);

            assertThat(sql).containsIgnoringCase("CREATE TABLE tempora_identity");
            assertThat(sql).containsIgnoringCase("UNIQUE (tenant_id, entity_type, business_key)");
        }
    }

    @Nested
    @DisplayName("V2 version tables")
    class VersionTables {

        @Test
        @DisplayName("creates the version sequence, satellite and current-slot tables")
        void createsObjects() throws IOException {
            String sql = readClasspathResource(V2);

            assertThat(sql).containsIgnoringCase("CREATE SEQUENCE tempora_version_seq");
            assertThat(sql).containsIgnoringCase("CREATE TABLE tempora_version");
            assertThat(sql).containsIgnoringCase("CREATE TABLE tempora_current_version");
        }

        @Test
        @DisplayName("version numbers are globally unique and intervals are never inverted")
        void versionConstraints() throws IOException {
            String sql = readClasspathResource(V2);

            assertThat(sql).containsIgnoringCase("UNIQUE (version_seq)");
            assertThat(sql).containsIgnoringCase("CHECK (effective_end IS NULL OR effective_end >= effective_start)");
        }
    }

    private String readClasspathResource(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as("Resource %s must exist", path).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
