package com.lensql.repositories.rdbms;

import com.lensql.core.config.ClientConfig;
import com.lensql.core.config.StorageConfig;
import com.lensql.core.meta.EntityRegistry;

/**
 * A database backend: builds clients for a storage configuration and releases what it created.
 */
public interface Plugin {
    LensClient createClient(StorageConfig config, EntityRegistry registry, ClientConfig clientConfig);

    default LensClient createClient(StorageConfig config, EntityRegistry registry) {
        return createClient(config, registry, ClientConfig.defaults());
    }

    void cleanUp();

    default boolean isHealthy() {
        return true;
    }
}
