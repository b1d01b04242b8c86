package com.tempora.persistence.jdbc.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.tempora.persistence.jdbc.H2Databases;
import com.tempora.persistence.jdbc.JdbcPersistenceBackend;
import com.tempora.persistence.jdbc.migration.SchemaMigrator;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

@DisplayName("JdbcStoreConfiguration")
class JdbcStoreConfigurationTest {

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner().withUserConfiguration(JdbcStoreConfiguration.class);

    @Test
    @DisplayName("is annotated with @Configuration")
    void isConfiguration() {
        assertThat(JdbcStoreConfiguration.class.isAnnotationPresent(Configuration.class)).isTrue();
    }

    @Nested
    @DisplayName("with tempora.backend=jdbc")
    class Enabled {

        @Test
        @DisplayName("creates a migrated pool and a ready backend")
        void createsBeans() {
            runner.withPropertyValues(
                            "tempora.backend=jdbc",
                            "tempora.datasource.url=" + H2Databases.freshUrl(),
                            "tempora.datasource.username=sa",
                            "tempora.datasource.maximum-pool-size=3")
                    .run(context -> {
                        assertThat(context).hasNotFailed();
                        assertThat(context).hasBean(JdbcStoreConfiguration.DATA_SOURCE_BEAN);
                        assertThat(context.getBean(HikariDataSource.class).getMaximumPoolSize()).isEqualTo(3);
                        assertThat(context.getBean(SchemaMigrator.class).status().upToDate()).isTrue();
                        assertThat(context.getBean(JdbcPersistenceBackend.class).probe().available()).isTrue();
                    });
        }

        @Test
        @DisplayName("skips migration when migrate-on-startup is false")
        void skipsMigration() {
            runner.withPropertyValues(
                            "tempora.backend=jdbc",
                            "tempora.datasource.url=" + H2Databases.freshUrl(),
                            "tempora.datasource.username=sa",
                            "tempora.datasource.migrate-on-startup=false")
                    .run(context -> assertThat(context.getBean(SchemaMigrator.class).status().pendingMigrations())
                            .isEqualTo(2));
        }

        @Test
        @DisplayName("fails fast without a JDBC URL")
        void requiresUrl() {
            runner.withPropertyValues("tempora.backend=jdbc", "tempora.datasource.username=sa")
                    .run(context -> assertThat(context).hasFailed());
        }
    }

    @Test
    @DisplayName("creates nothing for other backends")
    void disabled() {
        runner.withPropertyValues("tempora.backend=memory")
                .run(context -> assertThat(context).doesNotHaveBean(JdbcPersistenceBackend.class));
    }
}
