package io.cubedash.db;

import io.cubedash.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {
    private Database() {
    }

    /**
     * Builds a connection pool for API requests.
     */
    public static HikariDataSource createApiDataSource(AppConfig cfg) {
        return createDataSource(cfg, "api", cfg.dbApiPoolMax());
    }

    /**
     * Builds a connection pool for summary generation jobs.
     */
    public static HikariDataSource createGenDataSource(AppConfig cfg) {
        return createDataSource(cfg, "gen", cfg.dbGenPoolMax());
    }

    /**
     * Shared helper to build a configured pool with a named role.
     */
    private static HikariDataSource createDataSource(AppConfig cfg, String role, int maxPool) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        hc.setUsername(cfg.dbUsername());
        hc.setPassword(cfg.dbPassword());
        hc.setPoolName("cubedash-" + role);
        hc.setMaximumPoolSize(Math.max(2, maxPool));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        hc.addDataSourceProperty("ApplicationName", "cubedash-" + role);
        // connect on first use, not at pool construction
        hc.setInitializationFailTimeout(-1);
        return new HikariDataSource(hc);
    }
}
