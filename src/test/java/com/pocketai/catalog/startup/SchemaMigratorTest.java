package com.pocketai.catalog.startup;

import java.sql.Connection;
import java.sql.ResultSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.flywaydb.core.api.output.MigrateResult;
import org.junit.jupiter.api.Test;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;

class SchemaMigratorTest {

    @Test
    void migrate_createsCatalogTables_andIsRepeatable() throws Exception {
        try (HikariDataSource ds = h2("schema_" + System.nanoTime())) {
            MigrateResult first = SchemaMigrator.migrate(ds);
            MigrateResult second = SchemaMigrator.migrate(ds);

            assertEquals(1, first.migrationsExecuted);
            assertEquals(0, second.migrationsExecuted);
            try (Connection conn = ds.getConnection()) {
                for (String table : new String[] {"USERS", "ML_MODELS", "ML_MODEL_TAGS"}) {
                    try (ResultSet rs = conn.getMetaData().getTables(null, null, table, null)) {
                        assertTrue(rs.next(), table + " should exist");
                    }
                }
            }
        }
    }

    @Test
    void buildEntityManagerFactory_mapsEntitiesOverMigratedSchema() {
        try (HikariDataSource ds = h2("emf_" + System.nanoTime())) {
            SchemaMigrator.migrate(ds);
            EntityManagerFactory emf = SchemaMigrator.buildEntityManagerFactory(ds);
            EntityManager em = emf.createEntityManager();
            try {
                Long count = em.createQuery("SELECT COUNT(m) FROM CatalogModel m", Long.class).getSingleResult();
                assertEquals(0L, count);
            } finally {
                em.close();
                emf.close();
            }
        }
    }

    private static HikariDataSource h2(String name) {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL");
        cfg.setUsername("sa");
        cfg.setPassword("");
        return new HikariDataSource(cfg);
    }
}
