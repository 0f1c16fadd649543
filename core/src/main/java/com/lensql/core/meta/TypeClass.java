package com.lensql.core.meta;

import com.lensql.core.where.Operator;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.lensql.core.where.Operator.*;

/**
 * Groups scalar types by the operators they admit. This table is the single source for both
 * generated predicate functions and runtime validation.
 */
public enum TypeClass {
    STRING(EnumSet.of(EQUALS, NOT_EQUALS, GT, LT, GTE, LTE, IN, NOT_IN,
            CONTAINS, STARTS_WITH, ENDS_WITH, IS_NULL, IS_NOT_NULL), false, true),
    NUMERIC(EnumSet.of(EQUALS, NOT_EQUALS, GT, LT, GTE, LTE, IN, NOT_IN, IS_NULL, IS_NOT_NULL), true, false),
    DATETIME(EnumSet.of(EQUALS, NOT_EQUALS, GT, LT, GTE, LTE, IN, NOT_IN, IS_NULL, IS_NOT_NULL), false, false),
    BOOLEAN(EnumSet.of(EQUALS, NOT_EQUALS, IS_NULL, IS_NOT_NULL), false, false),
    UUID(EnumSet.of(EQUALS, NOT_EQUALS, IN, NOT_IN, IS_NULL, IS_NOT_NULL), false, false),
    JSON(EnumSet.of(EQUALS, NOT_EQUALS, IS_NULL, IS_NOT_NULL,
            JSON_STRING_CONTAINS, JSON_STRING_STARTS_WITH, JSON_STRING_ENDS_WITH,
            JSON_ARRAY_CONTAINS, JSON_ARRAY_STARTS_WITH, JSON_ARRAY_ENDS_WITH,
            JSON_OBJECT_CONTAINS, JSON_NULL), false, false),
    OPAQUE(EnumSet.of(EQUALS, NOT_EQUALS, IN, NOT_IN, IS_NULL, IS_NOT_NULL), false, false);

    private final Set<Operator> operators;
    private final boolean arithmetic;
    private final boolean modes;

    TypeClass(EnumSet<Operator> operators, boolean arithmetic, boolean modes) {
        this.operators = Collections.unmodifiableSet(operators);
        this.arithmetic = arithmetic;
        this.modes = modes;
    }

    public Set<Operator> operators() {
        return operators;
    }

    public boolean allows(Operator operator) {
        return operators.contains(operator);
    }

    /**
     * Whether increment/decrement/multiply/divide apply.
     */
    public boolean supportsArithmetic() {
        return arithmetic;
    }

    /**
     * Whether a {@link com.lensql.core.where.QueryMode} may be attached.
     */
    public boolean supportsModes() {
        return modes;
    }
}
