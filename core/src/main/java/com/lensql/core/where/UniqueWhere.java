package com.lensql.core.where;

import com.lensql.core.Key;

/**
 * Selects at most one row through a primary-key or unique field.
 */
public record UniqueWhere(String field, Key key) {

    public static UniqueWhere of(String field, Object value) {
        return new UniqueWhere(field, Key.from(value));
    }
}
