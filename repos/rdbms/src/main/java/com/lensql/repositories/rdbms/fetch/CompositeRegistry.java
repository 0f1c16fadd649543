package com.lensql.repositories.rdbms.fetch;

import com.lensql.core.EntityTypeRegistry;
import com.lensql.core.Key;
import com.lensql.core.QueryValidationException;
import com.lensql.core.meta.EntityRegistry;
import com.lensql.core.meta.ScalarType;

import java.util.Optional;

/**
 * Resolves an entity name to its fetcher and to the key types its table expects.
 */
public class CompositeRegistry implements EntityTypeRegistry {
    private final EntityRegistry entities;
    private final FetcherRegistry fetchers;

    public CompositeRegistry(EntityRegistry entities, FetcherRegistry fetchers) {
        this.entities = entities;
        this.fetchers = fetchers;
    }

    public EntityFetcher fetcher(String entity) {
        return fetchers.lookup(entity).orElseThrow(() ->
                new QueryValidationException("No fetcher registered for entity '" + entity + "'"));
    }

    public FetcherRegistry fetchers() {
        return fetchers;
    }

    /**
     * Converts a key-like value to the type of {@code field} on {@code entity}.
     */
    public Object fieldValue(String entity, String field, Object value) {
        return value == null ? null : Key.from(value).asValueFor(this, entity, field);
    }

    public Object primaryKeyValue(String entity, Object value) {
        return value == null ? null : Key.from(value).asValueFor(this, entity);
    }

    @Override
    public Optional<ScalarType> primaryKeyType(String entity) {
        return entities.primaryKeyType(entity).filter(t -> t != ScalarType.OPAQUE && t != ScalarType.JSON);
    }

    @Override
    public Optional<ScalarType> fieldType(String entity, String field) {
        return entities.fieldType(entity, field).filter(t -> t != ScalarType.OPAQUE && t != ScalarType.JSON);
    }

    @Override
    public Optional<ScalarType> foreignKeyType(String entity, String field) {
        return entities.foreignKeyType(entity, field).filter(t -> t != ScalarType.OPAQUE && t != ScalarType.JSON);
    }
}
