package com.tempora.persistence.jdbc.config;

import com.tempora.persistence.jdbc.migration.SchemaMigrator;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and migration settings for the JDBC backend, bound from {@code tempora.datasource.*}.
 *
 * @param url JDBC connection URL (e.g., {@code jdbc:postgresql://localhost:5432/tempora})
 * @param username database username
 * @param password database password
 * @param locations Flyway migration locations, defaults to {@link SchemaMigrator#DEFAULT_LOCATION}
 * @param maximumPoolSize Hikari pool size, defaults to 10
 * @param migrateOnStartup whether to apply pending migrations when the context starts, defaults to true
 */
@Validated
@ConfigurationProperties(prefix = "tempora.datasource")
public record StoreDataSourceProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        @Min(1) Integer maximumPoolSize,
        Boolean migrateOnStartup) {

    public static final int DEFAULT_POOL_SIZE = 10;

    public StoreDataSourceProperties {
        if (locations == null || locations.isBlank()) {
            locations = SchemaMigrator.DEFAULT_LOCATION;
        }
        if (maximumPoolSize == null) {
            maximumPoolSize = DEFAULT_POOL_SIZE;
        }
        if (migrateOnStartup == null) {
            migrateOnStartup = Boolean.TRUE;
        }
    }
}
