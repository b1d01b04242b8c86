package com.tempora.persistence.jdbc.config;

import com.tempora.persistence.jdbc.JdbcPersistenceBackend;
import com.tempora.persistence.jdbc.migration.SchemaMigrator;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Wires the JDBC backend when {@code tempora.backend=jdbc}: a Hikari pool, the schema migrator
 * (run at startup unless disabled) and the backend itself.
 *
 * <p>The service excludes Spring Boot's own DataSource and Flyway auto-configuration, so these
 * beans are the only ones touching the store's database.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(StoreDataSourceProperties.class)
@ConditionalOnProperty(prefix = "tempora", name = "backend", havingValue = "jdbc")
public class JdbcStoreConfiguration {

    /** Bean name of the store's connection pool. */
    public static final String DATA_SOURCE_BEAN = "temporaDataSource";

    /** Bean name of the schema migrator. */
    public static final String SCHEMA_MIGRATOR_BEAN = "temporaSchemaMigrator";

    /** Bean name of the persistence backend. */
    public static final String BACKEND_BEAN = "jdbcPersistenceBackend";

    @Bean(name = DATA_SOURCE_BEAN)
    public HikariDataSource temporaDataSource(StoreDataSourceProperties properties) {
        HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
        dataSource.setPoolName("tempora");
        dataSource.setMaximumPoolSize(properties.maximumPoolSize());
        return dataSource;
    }

    @Bean(name = SCHEMA_MIGRATOR_BEAN)
    public SchemaMigrator temporaSchemaMigrator(
            @Qualifier(DATA_SOURCE_BEAN) DataSource dataSource, StoreDataSourceProperties properties) {
        SchemaMigrator migrator = new SchemaMigrator(dataSource, properties.locations());
        if (properties.migrateOnStartup()) {
            migrator.migrate();
        }
        return migrator;
    }

    /** Depends on the migrator so the schema exists before the first transaction. */
    @Bean(name = BACKEND_BEAN)
    public JdbcPersistenceBackend jdbcPersistenceBackend(
            @Qualifier(DATA_SOURCE_BEAN) DataSource dataSource, SchemaMigrator schemaMigrator) {
        return new JdbcPersistenceBackend(dataSource);
    }
}
