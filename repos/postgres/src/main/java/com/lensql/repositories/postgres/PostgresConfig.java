package com.lensql.repositories.postgres;

import com.lensql.core.config.StorageConfig;

public class PostgresConfig extends StorageConfig {
    public String uri;
    public String username;
    public String password;
    public int maxPoolSize = 10;
    public int minIdle = 1;

    public PostgresConfig() {
        super("postgres");
    }

    public PostgresConfig(String uri, String username, String password) {
        this();
        this.uri = uri;
        this.username = username;
        this.password = password;
    }
}
