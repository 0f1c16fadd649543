package com.lensql.core.where;

/**
 * String comparison mode. Applies to every predicate on the same field in one predicate list.
 */
public enum QueryMode {
    DEFAULT,
    INSENSITIVE
}
