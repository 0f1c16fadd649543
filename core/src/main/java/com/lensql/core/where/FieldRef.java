package com.lensql.core.where;

import com.fasterxml.jackson.databind.JsonNode;
import com.lensql.core.Key;

import java.util.Arrays;
import java.util.List;

public class FieldRef {
    private final String field;

    public FieldRef(String field) {
        this.field = field;
    }

    public String name() {
        return field;
    }

    public WhereParam op(Operator operator, Object operand) {
        return new WhereParam.FieldPredicate(field, new FieldOp(operator, operand));
    }

    public WhereParam eq(Object value) {
        return op(Operator.EQUALS, value);
    }

    public WhereParam not(Object value) {
        return op(Operator.NOT_EQUALS, value);
    }

    public WhereParam gt(Object value) {
        return op(Operator.GT, value);
    }

    public WhereParam lt(Object value) {
        return op(Operator.LT, value);
    }

    public WhereParam gte(Object value) {
        return op(Operator.GTE, value);
    }

    public WhereParam lte(Object value) {
        return op(Operator.LTE, value);
    }

    public WhereParam in(List<?> values) {
        return op(Operator.IN, List.copyOf(values));
    }

    public WhereParam notIn(List<?> values) {
        return op(Operator.NOT_IN, List.copyOf(values));
    }

    public WhereParam contains(String value) {
        return op(Operator.CONTAINS, value);
    }

    public WhereParam startsWith(String value) {
        return op(Operator.STARTS_WITH, value);
    }

    public WhereParam endsWith(String value) {
        return op(Operator.ENDS_WITH, value);
    }

    public WhereParam isNull() {
        return op(Operator.IS_NULL, null);
    }

    public WhereParam isNotNull() {
        return op(Operator.IS_NOT_NULL, null);
    }

    public WhereParam mode(QueryMode mode) {
        return new WhereParam.ModeParam(field, mode);
    }

    public WhereParam path(String... segments) {
        return new WhereParam.JsonPathParam(field, Arrays.asList(segments));
    }

    public WhereParam stringContains(String value) {
        return op(Operator.JSON_STRING_CONTAINS, value);
    }

    public WhereParam stringStartsWith(String value) {
        return op(Operator.JSON_STRING_STARTS_WITH, value);
    }

    public WhereParam stringEndsWith(String value) {
        return op(Operator.JSON_STRING_ENDS_WITH, value);
    }

    public WhereParam arrayContains(JsonNode value) {
        return op(Operator.JSON_ARRAY_CONTAINS, value);
    }

    public WhereParam arrayStartsWith(JsonNode value) {
        return op(Operator.JSON_ARRAY_STARTS_WITH, value);
    }

    public WhereParam arrayEndsWith(JsonNode value) {
        return op(Operator.JSON_ARRAY_ENDS_WITH, value);
    }

    public WhereParam objectContains(String key) {
        return op(Operator.JSON_OBJECT_CONTAINS, key);
    }

    public WhereParam jsonNull(JsonNullFilter filter) {
        return op(Operator.JSON_NULL, filter);
    }

    public UniqueWhere equals(Key key) {
        return new UniqueWhere(field, key);
    }

    public SetParam set(Object value) {
        return new SetParam.Assign(field, value);
    }

    public SetParam increment(Number amount) {
        return SetParam.increment(field, amount);
    }

    public SetParam decrement(Number amount) {
        return SetParam.decrement(field, amount);
    }

    public SetParam multiply(Number amount) {
        return SetParam.multiply(field, amount);
    }

    public SetParam divide(Number amount) {
        return SetParam.divide(field, amount);
    }

    public OrderBy order(SortOrder order) {
        return new OrderBy(field, order, NullsOrder.DEFAULT);
    }
}
