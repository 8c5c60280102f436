package com.pocketai.catalog.config;

import java.util.Map;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates a HikariCP DataSource from environment variables. PostgreSQL is used
 * when {@code DB_URL} or {@code DB_HOST} is set; otherwise an in-memory H2
 * database in PostgreSQL compatibility mode.
 */
public final class DataSourceFactory {

    static final String H2_FALLBACK_URL = "jdbc:h2:mem:catalog;DB_CLOSE_DELAY=-1;MODE=PostgreSQL";
    private static final int DEFAULT_POOL_SIZE = 10;

    private DataSourceFactory() {
    }

    public static HikariDataSource create(Map<String, String> env) {
        HikariConfig cfg = new HikariConfig();
        if (isPostgresConfigured(env)) {
            String jdbcUrl = env.get("DB_URL");
            if (jdbcUrl == null || jdbcUrl.isBlank()) {
                String host = env.getOrDefault("DB_HOST", "localhost");
                String port = env.getOrDefault("DB_PORT", "5432");
                String db = env.getOrDefault("DB_NAME", "pocketai");
                jdbcUrl = "jdbc:postgresql://" + host + ":" + port + "/" + db;
            }
            cfg.setJdbcUrl(jdbcUrl);
            cfg.setUsername(env.getOrDefault("DB_USER", "postgres"));
            String pass = env.get("DB_PASSWORD");
            if (pass != null) {
                cfg.setPassword(pass);
            }
            cfg.setDriverClassName("org.postgresql.Driver");
        } else {
            cfg.setJdbcUrl(H2_FALLBACK_URL);
            cfg.setUsername("sa");
            cfg.setPassword("");
            cfg.setDriverClassName("org.h2.Driver");
        }
        cfg.setMaximumPoolSize(poolSize(env));
        cfg.setPoolName("catalog-hikari");
        return new HikariDataSource(cfg);
    }

    public static boolean isPostgresConfigured(Map<String, String> env) {
        return notBlank(env.get("DB_URL")) || notBlank(env.get("DB_HOST"));
    }

    private static int poolSize(Map<String, String> env) {
        String raw = env.get("DB_POOL_SIZE");
        if (raw == null || raw.isBlank()) {
            return DEFAULT_POOL_SIZE;
        }
        try {
            int size = Integer.parseInt(raw.trim());
            return size > 0 ? size : DEFAULT_POOL_SIZE;
        } catch (NumberFormatException e) {
            return DEFAULT_POOL_SIZE;
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
