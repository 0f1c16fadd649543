package com.lensql.repositories.postgres;

import com.lensql.core.config.ClientConfig;
import com.lensql.core.config.StorageConfig;
import com.lensql.core.meta.EntityRegistry;
import com.lensql.repositories.rdbms.LensClient;
import com.lensql.repositories.rdbms.Plugin;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL plugin. Keeps one HikariCP pool per connection URI.
 */
public class PostgresPlugin implements Plugin {
    private static final Logger logger = LoggerFactory.getLogger(PostgresPlugin.class);

    private final Map<String, HikariDataSource> dataSources = new HashMap<>();
    private final List<LensClient> clients = new ArrayList<>();

    @Override
    public synchronized LensClient createClient(StorageConfig config, EntityRegistry registry, ClientConfig clientConfig) {
        if (!(config instanceof PostgresConfig pgConfig)) {
            throw new IllegalArgumentException("Expected PostgresConfig, got " + config.getClass().getSimpleName());
        }
        LensClient client = new LensClient(getOrCreateDataSource(pgConfig), new PostgresDialect(), registry, clientConfig);
        clients.add(client);
        return client;
    }

    @Override
    public synchronized void cleanUp() {
        clients.forEach(LensClient::close);
        clients.clear();
        for (HikariDataSource dataSource : dataSources.values()) {
            dataSource.close();
        }
        dataSources.clear();
    }

    @Override
    public synchronized boolean isHealthy() {
        for (HikariDataSource ds : dataSources.values()) {
            try (Connection conn = ds.getConnection()) {
                if (!conn.isValid(1)) {
                    return false;
                }
            } catch (SQLException e) {
                logger.warn("Postgres health check failed: {}", e.getMessage());
                return false;
            }
        }
        return !dataSources.isEmpty();
    }

    /**
     * Reuses the pool of an earlier config with the same URI.
     */
    private DataSource getOrCreateDataSource(PostgresConfig config) {
        if (config.uri == null) {
            throw new IllegalArgumentException("PostgresConfig.uri is required");
        }
        return dataSources.computeIfAbsent(config.uri, k -> {
            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(config.uri);

            if (config.username != null) {
                hikariConfig.setUsername(config.username);
            }
            if (config.password != null) {
                hikariConfig.setPassword(config.password);
            }

            hikariConfig.setMaximumPoolSize(config.maxPoolSize);
            hikariConfig.setMinimumIdle(config.minIdle);
            logger.info("Creating connection pool for {}", config.uri);
            return new HikariDataSource(hikariConfig);
        });
    }
}
