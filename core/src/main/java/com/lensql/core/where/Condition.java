package com.lensql.core.where;

import com.lensql.core.meta.FieldMetadata;

import java.util.List;

/**
 * Backend-neutral predicate tree produced by {@link ConditionResolver}. Column references are
 * unqualified; the renderer decides which table alias they belong to.
 */
public interface Condition {

    record All(List<Condition> conditions) implements Condition {
        public All {
            conditions = List.copyOf(conditions);
        }
    }

    record Any(List<Condition> conditions) implements Condition {
        public Any {
            conditions = List.copyOf(conditions);
        }
    }

    record Not(Condition condition) implements Condition {
    }

    /**
     * @param field   the compared field
     * @param op      the operator, already checked against the field's type class
     * @param operand raw operand, converted to the field type at render time
     * @param mode    string comparison mode collected for the field
     * @param path    JSON path collected for the field, empty for the document root
     */
    record Comparison(FieldMetadata field, Operator op, Object operand, QueryMode mode, List<String> path)
            implements Condition {
        public Comparison {
            path = List.copyOf(path);
        }
    }

    /**
     * Correlated existence check against a related table: rows of {@code targetTable} whose
     * {@code innerColumn} equals the enclosing row's {@code outerColumn} and that satisfy
     * {@code filter}.
     */
    record Exists(String targetTable, String innerColumn, String outerColumn, Condition filter, boolean negated)
            implements Condition {
    }

    record Constant(boolean value) implements Condition {
    }

    Condition TRUE = new Constant(true);
    Condition FALSE = new Constant(false);
}
