package com.lensql.core.meta;

public enum RelationKind {
    HAS_MANY,
    BELONGS_TO,
    HAS_ONE;

    /**
     * BelongsTo relations keep the foreign key on the declaring entity, the others on the target.
     */
    public boolean ownsForeignKey() {
        return this == BELONGS_TO;
    }
}
