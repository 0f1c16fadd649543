package com.lensql.generator.analyze;

import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.Naming;

import java.util.List;
import java.util.Optional;

public record EntityDraft(
        String name,
        String tableName,
        List<FieldMetadata> fields,
        List<RelationDraft> relations
) {
    /**
     * Finds a field by a column reference such as {@code author_id}, matching the snake_case form of
     * the field name or its column.
     */
    public Optional<FieldMetadata> findField(String reference) {
        return fields.stream()
                .filter(f -> Naming.snakeCase(f.name()).equals(reference)
                        || f.name().equals(reference)
                        || f.columnName().equals(reference))
                .findFirst();
    }
}
