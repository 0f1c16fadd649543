package com.lensql.generator.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EntityDeclaration(
        @JsonProperty("name") String name,
        @JsonProperty("tableName") String tableName,
        @JsonProperty("fields") List<FieldDeclaration> fields,
        @JsonProperty("relations") List<RelationDeclaration> relations
) {}
