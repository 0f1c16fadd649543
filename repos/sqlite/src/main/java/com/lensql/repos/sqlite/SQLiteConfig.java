package com.lensql.repos.sqlite;

import com.lensql.core.config.StorageConfig;

public class SQLiteConfig extends StorageConfig {
    public String file;
    public int busyTimeoutMillis = 5000;
    public boolean enforceForeignKeys = true;

    public SQLiteConfig(String file) {
        super("sqlite");
        this.file = file;
    }
}
