package com.lensql.core.where;

import java.util.List;

/**
 * One node of a predicate list. Lists are combined with AND unless wrapped in a {@link Logical}.
 */
public interface WhereParam {

    record FieldPredicate(String field, FieldOp op) implements WhereParam {
    }

    /**
     * Sets the string comparison mode for every predicate on {@code field} in the same list.
     */
    record ModeParam(String field, QueryMode mode) implements WhereParam {
    }

    /**
     * Sets the JSON path for every JSON predicate on {@code field} in the same list.
     */
    record JsonPathParam(String field, List<String> path) implements WhereParam {
        public JsonPathParam {
            path = List.copyOf(path);
        }
    }

    record Logical(LogicalOp op, List<WhereParam> params) implements WhereParam {
        public Logical {
            params = List.copyOf(params);
        }
    }

    record RelationPredicate(String relation, Quantifier quantifier, List<WhereParam> params) implements WhereParam {
        public RelationPredicate {
            params = List.copyOf(params);
        }
    }

    enum LogicalOp {
        AND,
        OR,
        NOT
    }

    enum Quantifier {
        SOME,
        EVERY,
        NONE
    }
}
