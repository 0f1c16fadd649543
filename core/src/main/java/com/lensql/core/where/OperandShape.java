package com.lensql.core.where;

/**
 * What an operator takes as its argument. Drives the signature of generated predicate functions.
 */
public enum OperandShape {
    /** a value of the field's own type */
    VALUE,
    /** a list of values of the field's type */
    LIST,
    /** no argument */
    NONE,
    /** a string, independent of the field type */
    TEXT,
    /** a JSON value */
    JSON,
    /** a {@link JsonNullFilter} */
    JSON_NULL
}
