package com.pocketai.catalog.startup;

import java.util.Map;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pocketai.catalog.config.DataSourceFactory;
import com.zaxxer.hikari.HikariDataSource;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.EntityManagerFactory;

/**
 * Initializes the catalog DataSource and EntityManagerFactory from environment
 * variables (Postgres via Hikari) or falls back to embedded H2 when Postgres is
 * not configured. Guard rails prevent falling back to H2 when Postgres
 * configuration exists but fails.
 */
@ApplicationScoped
public class AppDataSourceHolder {

    private static final Logger log = LoggerFactory.getLogger(AppDataSourceHolder.class);

    private EntityManagerFactory emf;
    private HikariDataSource ds;

    @PostConstruct
    public void init() {
        initFrom(System.getenv());
    }

    synchronized void initFrom(Map<String, String> env) {
        boolean postgresConfigured = DataSourceFactory.isPostgresConfigured(env);
        HikariDataSource newDs = null;
        try {
            newDs = DataSourceFactory.create(env);
            log.info("Initializing catalog datasource: {}", newDs.getJdbcUrl());
            SchemaMigrator.migrate(newDs);
            EntityManagerFactory newEmf = SchemaMigrator.buildEntityManagerFactory(newDs);
            this.ds = newDs;
            this.emf = newEmf;
            log.info("EntityManagerFactory initialized ({})", postgresConfigured ? "Postgres" : "H2");
        } catch (RuntimeException e) {
            if (newDs != null) {
                newDs.close();
            }
            if (postgresConfigured) {
                String msg = "Postgres configuration found but initialization failed; application cannot start.";
                log.error(msg, e);
                throw new IllegalStateException(msg, e);
            }
            log.error("Failed to init fallback H2 database: {}", e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Return the active EntityManagerFactory.
     */
    public synchronized EntityManagerFactory getEmf() {
        if (emf == null) {
            throw new IllegalStateException("EntityManagerFactory not initialized. Configure DB or check logs.");
        }
        return emf;
    }

    /**
     * Set the EntityManagerFactory (used when the database is prepared elsewhere).
     */
    public synchronized void setEmf(EntityManagerFactory emf) {
        this.emf = emf;
        log.info("EntityManagerFactory updated on AppDataSourceHolder");
    }

    /**
     * Return the underlying JDBC DataSource (Hikari).
     */
    public synchronized DataSource getDataSource() {
        if (this.ds == null) {
            throw new IllegalStateException("DataSource not initialized. Configure DB or check logs.");
        }
        return this.ds;
    }

    @PreDestroy
    public synchronized void close() {
        try {
            if (emf != null && emf.isOpen()) {
                emf.close();
            }
        } finally {
            if (ds != null) {
                ds.close();
            }
        }
        emf = null;
        ds = null;
        log.info("AppDataSourceHolder closed resources");
    }
}
