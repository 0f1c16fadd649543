package com.lensql.generator.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SchemaDocument(
        @JsonProperty("package") String packageName,
        @JsonProperty("schemaName") String schemaName,
        @JsonProperty("entities") List<EntityDeclaration> entities
) {}
