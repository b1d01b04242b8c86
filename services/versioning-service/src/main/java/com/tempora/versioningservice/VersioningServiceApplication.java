package com.tempora.versioningservice;

import com.tempora.versioningservice.config.TemporaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Tempora versioning service: the versioned entity store behind a REST API.
 *
 * <p>The store's database (when {@code tempora.backend=jdbc}) is wired by
 * {@link com.tempora.persistence.jdbc.config.JdbcStoreConfiguration}, so Spring Boot's own
 * DataSource and Flyway auto-configuration are switched off.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@EnableConfigurationProperties(TemporaProperties.class)
public class VersioningServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(VersioningServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(VersioningServiceApplication.class, args);
        log.info("Tempora versioning service started successfully");
    }
}
