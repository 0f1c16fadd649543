package com.lensql.generator.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A declared column. {@code type} is a type name such as {@code i64}, {@code Option<String>} or
 * {@code Optional<UUID>}; unknown names are carried through as opaque types.
 */
public record FieldDeclaration(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("primaryKey") boolean primaryKey,
        @JsonProperty("unique") boolean unique,
        @JsonProperty("column") String column
) {}
