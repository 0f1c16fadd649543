package com.lensql.generator.analyze;

import com.lensql.core.meta.RelationKind;

/**
 * A relation as seen by the first pass. For BelongsTo the foreign key has been checked against the
 * declaring entity; for HasMany and HasOne it is only a name until the target is known.
 */
public record RelationDraft(
        String name,
        RelationKind kind,
        String targetEntity,
        String foreignKeyField,
        String referencedField
) {}
