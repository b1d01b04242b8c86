package com.tempora.persistence.jdbc.migration;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.MigrationVersion;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;

/**
 * Applies and reports on the store's Flyway migrations.
 *
 * <p>This is a POJO (no Spring annotations): tests build one straight from a {@link DataSource},
 * and {@link com.tempora.persistence.jdbc.config.JdbcStoreConfiguration} wires it in the service.
 */
public class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    /** Classpath location of the store's migration scripts. */
    public static final String DEFAULT_LOCATION = "classpath:db/migration/tempora";

    /**
     * Outcome of a {@link #migrate()} run.
     *
     * @param migrationsExecuted number of scripts applied by this run
     * @param targetVersion schema version after the run (null if nothing was ever applied)
     * @param success whether Flyway reported success
     */
    public record MigrationReport(int migrationsExecuted, String targetVersion, boolean success) {}

    /**
     * One migration script as Flyway sees it.
     *
     * @param version migration version (e.g., "1", "2")
     * @param description migration description (e.g., "create identity tables")
     * @param state Flyway state name (e.g., "Success", "Pending")
     * @param installedOn when it was applied, or null if pending
     */
    public record MigrationInfo(String version, String description, String state, Instant installedOn) {}

    /**
     * Overall schema state.
     *
     * @param appliedMigrations number of applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion current schema version (null if no migrations applied)
     */
    public record SchemaStatus(int appliedMigrations, int pendingMigrations, String currentVersion) {

        public boolean upToDate() {
            return pendingMigrations == 0 && currentVersion != null;
        }
    }

    private final Flyway flyway;

    public SchemaMigrator(DataSource dataSource) {
        this(dataSource, DEFAULT_LOCATION);
    }

    public SchemaMigrator(DataSource dataSource, String locations) {
        this.flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(locations)
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }

    /** Applies every pending migration. */
    public MigrationReport migrate() {
        MigrateResult result = flyway.migrate();
        log.info("Schema migration finished: {} script(s) applied, schema at version {}",
                result.migrationsExecuted, result.targetSchemaVersion);
        return new MigrationReport(result.migrationsExecuted, result.targetSchemaVersion, result.success);
    }

    public SchemaStatus status() {
        MigrationInfoService info = flyway.info();
        return new SchemaStatus(info.applied().length, info.pending().length, versionOf(info.current()));
    }

    /** Every known migration, applied and pending, in version order. */
    public List<MigrationInfo> history() {
        List<MigrationInfo> migrations = new ArrayList<>();
        for (org.flywaydb.core.api.MigrationInfo migration : flyway.info().all()) {
            migrations.add(new MigrationInfo(
                    versionOf(migration),
                    migration.getDescription(),
                    migration.getState().getDisplayName(),
                    migration.getInstalledOn() == null ? null : migration.getInstalledOn().toInstant()));
        }
        return migrations;
    }

    // ── Private Helpers ──

    private static String versionOf(org.flywaydb.core.api.MigrationInfo migration) {
        if (migration == null) {
            return null;
        }
        MigrationVersion version = migration.getVersion();
        return version == null ? null : version.getVersion();
    }
}
