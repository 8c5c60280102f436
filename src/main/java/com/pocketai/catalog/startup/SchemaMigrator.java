package com.pocketai.catalog.startup;

import java.util.HashMap;
import java.util.Map;

import javax.sql.DataSource;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;

/**
 * Applies the Flyway migrations under {@code classpath:db/migration} and builds
 * the {@code CatalogPU} EntityManagerFactory over an already migrated
 * DataSource. Hibernate never generates DDL; Flyway owns the schema.
 */
public final class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    public static final String PERSISTENCE_UNIT = "CatalogPU";

    private SchemaMigrator() {
    }

    public static MigrateResult migrate(DataSource ds) {
        Flyway flyway = Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .load();
        log.info("Running Flyway migration...");
        MigrateResult result = flyway.migrate();
        log.info("Flyway migration complete ({} migration(s) applied)", result.migrationsExecuted);
        return result;
    }

    public static EntityManagerFactory buildEntityManagerFactory(DataSource ds) {
        // Hibernate accepts the DataSource instance itself under this key.
        Map<String, Object> props = new HashMap<>();
        props.put("jakarta.persistence.nonJtaDataSource", ds);
        props.put("hibernate.hbm2ddl.auto", "none");
        return Persistence.createEntityManagerFactory(PERSISTENCE_UNIT, props);
    }
}
