package com.lensql.repositories.rdbms.fetch;

import com.lensql.core.meta.Naming;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entity name to fetcher map. Names are normalised to lower case without namespace or
 * underscores, so {@code blog::BlogPost}, {@code blog_post} and {@code BLOGPOST} share a slot.
 */
public class FetcherRegistry {
    private final Map<String, EntityFetcher> fetchers = new ConcurrentHashMap<>();

    public void register(String entity, EntityFetcher fetcher) {
        fetchers.put(normalize(entity), fetcher);
    }

    public Optional<EntityFetcher> lookup(String entity) {
        if (entity == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(fetchers.get(normalize(entity)));
    }

    public boolean contains(String entity) {
        return lookup(entity).isPresent();
    }

    static String normalize(String entity) {
        return Naming.lastSegment(entity).replace("_", "").toLowerCase();
    }
}
