package com.lensql.core.meta;

import com.lensql.core.ContractViolationException;
import com.lensql.core.EntityTypeRegistry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of entity metadata, shared by every query issued against a client.
 *
 * <p>Lookups tolerate namespace-qualified names ({@code blog::Post}, {@code blog.Post}) and case
 * variations ({@code post}, {@code POST}, {@code blog_post}).
 */
public class EntityRegistry implements EntityTypeRegistry {
    private final Map<String, EntityMetadata> entities;

    public EntityRegistry(List<EntityMetadata> entities) {
        Map<String, EntityMetadata> byName = new LinkedHashMap<>();
        for (EntityMetadata entity : entities) {
            if (byName.put(entity.name(), entity) != null) {
                throw new IllegalArgumentException("Duplicate entity " + entity.name());
            }
        }
        this.entities = Collections.unmodifiableMap(byName);
    }

    public Collection<EntityMetadata> entities() {
        return entities.values();
    }

    public Optional<EntityMetadata> lookup(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        EntityMetadata exact = entities.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        String bare = Naming.lastSegment(name);
        for (String candidate : List.of(bare, Naming.pascalCase(bare), Naming.pascalCase(bare.toLowerCase()))) {
            EntityMetadata found = entities.get(candidate);
            if (found != null) {
                return Optional.of(found);
            }
        }
        return entities.values().stream()
                .filter(e -> e.name().equalsIgnoreCase(bare) || e.name().equalsIgnoreCase(bare.replace("_", "")))
                .findFirst();
    }

    public EntityMetadata require(String name) {
        return lookup(name).orElseThrow(() -> new ContractViolationException("Unknown entity '" + name + "'"));
    }

    @Override
    public Optional<ScalarType> primaryKeyType(String entity) {
        return lookup(entity).map(e -> e.primaryKey().type());
    }

    @Override
    public Optional<ScalarType> fieldType(String entity, String field) {
        return lookup(entity).flatMap(e -> e.field(field)).map(FieldMetadata::type);
    }

    @Override
    public Optional<ScalarType> foreignKeyType(String entity, String field) {
        return lookup(entity).flatMap(e -> e.foreignKeyType(field).or(() -> e.field(field).map(FieldMetadata::type)));
    }
}
