package com.lensql.core.where;

import java.util.Arrays;
import java.util.List;

/**
 * Untyped entry point for building predicates by field and relation name. Generated entity
 * classes delegate here with typed signatures.
 */
public final class Where {
    private Where() {
    }

    public static FieldRef field(String name) {
        return new FieldRef(name);
    }

    public static RelationRef relation(String name) {
        return new RelationRef(name);
    }

    public static WhereParam and(WhereParam... params) {
        return new WhereParam.Logical(WhereParam.LogicalOp.AND, Arrays.asList(params));
    }

    public static WhereParam or(WhereParam... params) {
        return new WhereParam.Logical(WhereParam.LogicalOp.OR, Arrays.asList(params));
    }

    public static WhereParam not(WhereParam... params) {
        return new WhereParam.Logical(WhereParam.LogicalOp.NOT, Arrays.asList(params));
    }

    public static WhereParam and(List<WhereParam> params) {
        return new WhereParam.Logical(WhereParam.LogicalOp.AND, params);
    }

    public static WhereParam or(List<WhereParam> params) {
        return new WhereParam.Logical(WhereParam.LogicalOp.OR, params);
    }

    public static WhereParam not(List<WhereParam> params) {
        return new WhereParam.Logical(WhereParam.LogicalOp.NOT, params);
    }
}
