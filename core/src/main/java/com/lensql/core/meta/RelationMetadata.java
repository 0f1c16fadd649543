package com.lensql.core.meta;

/**
 * A resolved relation between two entities.
 *
 * <p>For {@link RelationKind#BELONGS_TO} the foreign key lives on the declaring entity and references
 * the target; for {@link RelationKind#HAS_MANY} and {@link RelationKind#HAS_ONE} it lives on the target
 * and references the declaring entity.
 *
 * @param name               relation name
 * @param kind               cardinality and ownership
 * @param targetEntity       name of the related entity
 * @param targetTable        table of the related entity
 * @param foreignKeyField    field holding the foreign key, on whichever side owns it
 * @param foreignKeyColumn   column of {@code foreignKeyField}
 * @param referencedField    field the foreign key points at, on the other side
 * @param referencedColumn   column of {@code referencedField}
 * @param foreignKeyType     type of the foreign key, null when the owning entity is external
 * @param foreignKeyNullable whether the foreign key admits null
 */
public record RelationMetadata(
        String name,
        RelationKind kind,
        String targetEntity,
        String targetTable,
        String foreignKeyField,
        String foreignKeyColumn,
        String referencedField,
        String referencedColumn,
        ScalarType foreignKeyType,
        boolean foreignKeyNullable
) {
    public boolean isMany() {
        return kind == RelationKind.HAS_MANY;
    }
}
