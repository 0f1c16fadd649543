package com.lensql.core.config;

/**
 * Base class for backend connection settings. Each backend module subclasses it.
 */
public class StorageConfig {
    public String type;

    public StorageConfig(String type) {
        this.type = type;
    }
}
