package com.lensql.repositories.rdbms.sql;

import com.lensql.core.meta.ScalarType;

/**
 * A bound statement parameter. {@code value} is already converted to the Java type of {@code type}.
 */
public record SqlParam(Object value, ScalarType type) {
}
