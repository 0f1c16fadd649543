package com.lensql.repos.sqlite;

import com.lensql.core.config.ClientConfig;
import com.lensql.core.config.StorageConfig;
import com.lensql.core.meta.EntityRegistry;
import com.lensql.repositories.rdbms.LensClient;
import com.lensql.repositories.rdbms.Plugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.File;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds SQLite clients, one data source per database file. {@code :memory:} databases are shared
 * in-memory databases kept alive by an anchor connection until {@link #cleanUp()}.
 */
public class SQLitePlugin implements Plugin {
    private static final Logger logger = LoggerFactory.getLogger(SQLitePlugin.class);
    private static final String MEMORY = ":memory:";
    private static final AtomicInteger memoryDatabases = new AtomicInteger();

    private final Map<String, SQLiteDataSource> dataSources = new ConcurrentHashMap<>();
    private final List<Connection> anchors = new ArrayList<>();
    private final List<LensClient> clients = new ArrayList<>();

    @Override
    public synchronized LensClient createClient(StorageConfig config, EntityRegistry registry, ClientConfig clientConfig) {
        if (!(config instanceof SQLiteConfig c)) {
            throw new IllegalArgumentException("Expected SQLiteConfig, got " + config.getClass().getSimpleName());
        }
        LensClient client = new LensClient(buildDatasource(c), new SQLiteDialect(), registry, clientConfig);
        clients.add(client);
        return client;
    }

    private DataSource buildDatasource(SQLiteConfig c) {
        if (dataSources.containsKey(c.file)) {
            return dataSources.get(c.file);
        }
        org.sqlite.SQLiteConfig sqlite = new org.sqlite.SQLiteConfig();
        sqlite.enforceForeignKeys(c.enforceForeignKeys);
        sqlite.setBusyTimeout(c.busyTimeoutMillis);

        SQLiteDataSource dataSource = new SQLiteDataSource(sqlite);
        if (MEMORY.equals(c.file)) {
            dataSource.setUrl("jdbc:sqlite:file:lensql" + memoryDatabases.incrementAndGet() + "?mode=memory&cache=shared");
            try {
                anchors.add(dataSource.getConnection());
            } catch (SQLException e) {
                throw new IllegalStateException("Failed to open in-memory SQLite database", e);
            }
        } else {
            dataSource.setUrl("jdbc:sqlite:" + c.file);
        }
        dataSources.put(c.file, dataSource);
        logger.debug("Created SQLite data source for {}", c.file);
        return dataSource;
    }

    @Override
    public synchronized void cleanUp() {
        clients.forEach(LensClient::close);
        clients.clear();
        for (Connection anchor : anchors) {
            try {
                anchor.close();
            } catch (SQLException e) {
                logger.warn("Failed to close in-memory SQLite database", e);
            }
        }
        anchors.clear();
        dataSources.keySet().forEach(file -> {
            if (!file.startsWith(MEMORY) && !new File(file).delete()) {
                logger.warn("Could not delete SQLite file {}", file);
            }
        });
        dataSources.clear();
    }

    @Override
    public boolean isHealthy() {
        for (SQLiteDataSource dataSource : dataSources.values()) {
            try (Connection conn = dataSource.getConnection()) {
                if (!conn.isValid(1)) {
                    return false;
                }
            } catch (SQLException e) {
                logger.warn("SQLite health check failed: {}", e.getMessage());
                return false;
            }
        }
        return true;
    }
}
