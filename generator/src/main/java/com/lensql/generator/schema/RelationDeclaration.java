package com.lensql.generator.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A declared relation.
 *
 * @param name   relation name
 * @param kind   {@code belongs_to}, {@code has_many} or {@code has_one}
 * @param target path to the target entity, e.g. {@code super::user::Entity}
 * @param from   column reference on the declaring side, e.g. {@code Column::AuthorId}
 * @param to     column reference on the target side, e.g. {@code super::user::Column::Id}
 */
public record RelationDeclaration(
        @JsonProperty("name") String name,
        @JsonProperty("kind") String kind,
        @JsonProperty("target") String target,
        @JsonProperty("from") String from,
        @JsonProperty("to") String to
) {}
