package com.lensql.core.meta;

import com.lensql.core.ContractViolationException;

import java.util.List;
import java.util.Optional;

/**
 * Static description of one entity: its table, fields and relations. Exactly one field is the
 * primary key.
 */
public record EntityMetadata(
        String name,
        String tableName,
        List<FieldMetadata> fields,
        List<RelationMetadata> relations
) {
    public EntityMetadata {
        fields = List.copyOf(fields);
        relations = List.copyOf(relations);
        long keys = fields.stream().filter(FieldMetadata::primaryKey).count();
        if (keys != 1) {
            throw new IllegalArgumentException("Entity " + name + " must declare exactly one primary key, found " + keys);
        }
    }

    public FieldMetadata primaryKey() {
        return fields.stream()
                .filter(FieldMetadata::primaryKey)
                .findFirst()
                .orElseThrow();
    }

    public Optional<FieldMetadata> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    public FieldMetadata requireField(String fieldName) {
        return field(fieldName).orElseThrow(() ->
                new ContractViolationException("Entity " + name + " has no field '" + fieldName + "'"));
    }

    public Optional<FieldMetadata> fieldByColumn(String column) {
        return fields.stream().filter(f -> f.columnName().equalsIgnoreCase(column)).findFirst();
    }

    public Optional<RelationMetadata> relation(String relationName) {
        return relations.stream().filter(r -> r.name().equals(relationName)).findFirst();
    }

    public RelationMetadata requireRelation(String relationName) {
        return relation(relationName).orElseThrow(() ->
                new ContractViolationException("Entity " + name + " has no relation '" + relationName + "'"));
    }

    /**
     * Foreign keys held by this entity, i.e. those of its BelongsTo relations.
     */
    public List<String> foreignKeyFields() {
        return relations.stream()
                .filter(r -> r.kind().ownsForeignKey())
                .map(RelationMetadata::foreignKeyField)
                .distinct()
                .toList();
    }

    public Optional<ScalarType> foreignKeyType(String fieldName) {
        return relations.stream()
                .filter(r -> r.kind().ownsForeignKey() && r.foreignKeyField().equals(fieldName))
                .map(RelationMetadata::foreignKeyType)
                .filter(t -> t != null)
                .findFirst();
    }
}
