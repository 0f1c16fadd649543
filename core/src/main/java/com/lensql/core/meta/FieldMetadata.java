package com.lensql.core.meta;

/**
 * One column of an entity.
 *
 * @param name         field name as declared
 * @param columnName   database column, defaults to the name
 * @param type         resolved scalar type
 * @param declaredType type name as written in the schema, kept for {@link ScalarType#OPAQUE} conversion
 * @param nullable     whether the column admits null
 * @param unique       whether the column is unique
 * @param primaryKey   whether this is the entity's primary key
 */
public record FieldMetadata(
        String name,
        String columnName,
        ScalarType type,
        String declaredType,
        boolean nullable,
        boolean unique,
        boolean primaryKey
) {
    public FieldMetadata {
        if (columnName == null || columnName.isEmpty()) {
            columnName = name;
        }
    }

    /**
     * Primary keys and unique columns can address a single row.
     */
    public boolean identifying() {
        return primaryKey || unique;
    }
}
