package com.lensql.core.where;

/**
 * Comparison operators a field predicate can carry. Which ones apply to a field is decided by
 * {@link com.lensql.core.meta.TypeClass}.
 */
public enum Operator {
    EQUALS("eq", OperandShape.VALUE),
    NOT_EQUALS("not", OperandShape.VALUE),
    GT("gt", OperandShape.VALUE),
    LT("lt", OperandShape.VALUE),
    GTE("gte", OperandShape.VALUE),
    LTE("lte", OperandShape.VALUE),
    IN("in", OperandShape.LIST),
    NOT_IN("notIn", OperandShape.LIST),
    CONTAINS("contains", OperandShape.VALUE),
    STARTS_WITH("startsWith", OperandShape.VALUE),
    ENDS_WITH("endsWith", OperandShape.VALUE),
    IS_NULL("isNull", OperandShape.NONE),
    IS_NOT_NULL("isNotNull", OperandShape.NONE),
    JSON_STRING_CONTAINS("stringContains", OperandShape.TEXT),
    JSON_STRING_STARTS_WITH("stringStartsWith", OperandShape.TEXT),
    JSON_STRING_ENDS_WITH("stringEndsWith", OperandShape.TEXT),
    JSON_ARRAY_CONTAINS("arrayContains", OperandShape.JSON),
    JSON_ARRAY_STARTS_WITH("arrayStartsWith", OperandShape.JSON),
    JSON_ARRAY_ENDS_WITH("arrayEndsWith", OperandShape.JSON),
    JSON_OBJECT_CONTAINS("objectContains", OperandShape.TEXT),
    JSON_NULL("jsonNull", OperandShape.JSON_NULL);

    private final String methodName;
    private final OperandShape shape;

    Operator(String methodName, OperandShape shape) {
        this.methodName = methodName;
        this.shape = shape;
    }

    /**
     * Name of the generated predicate function for this operator.
     */
    public String methodName() {
        return methodName;
    }

    public OperandShape shape() {
        return shape;
    }

    public boolean isJson() {
        return name().startsWith("JSON_");
    }

    public boolean isNullCheck() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }
}
