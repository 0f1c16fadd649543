package com.lensql.core;

import com.lensql.core.meta.ScalarType;

import java.util.Optional;

/**
 * Answers which concrete type an entity's keys have, so a {@link Key} can be turned into the
 * value the backend expects.
 */
public interface EntityTypeRegistry {
    Optional<ScalarType> primaryKeyType(String entity);

    Optional<ScalarType> fieldType(String entity, String field);

    default Optional<ScalarType> foreignKeyType(String entity, String field) {
        return fieldType(entity, field);
    }
}
