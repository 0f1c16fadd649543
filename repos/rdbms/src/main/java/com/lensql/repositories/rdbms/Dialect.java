package com.lensql.repositories.rdbms;

import com.lensql.core.meta.ScalarType;
import com.lensql.core.where.NullsOrder;
import com.lensql.core.where.Operator;
import com.lensql.core.where.QueryMode;
import com.lensql.core.where.SortOrder;
import com.lensql.repositories.rdbms.sql.SqlFragment;
import com.lensql.repositories.rdbms.sql.SqlParam;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * The parts of SQL generation and JDBC value handling that differ between databases.
 */
public abstract class Dialect {
    private final String name;
    private final SqlTemplates templates;

    protected Dialect(String name) {
        this.name = name;
        this.templates = SqlTemplates.load(name);
    }

    public String name() {
        return name;
    }

    public SqlTemplates templates() {
        return templates;
    }

    public String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Placeholder for a parameter of the given type, e.g. with a cast.
     */
    public String placeholder(ScalarType type) {
        return "?";
    }

    /**
     * LIMIT value meaning "no limit", for statements that only carry an OFFSET.
     */
    public abstract String unlimited();

    /**
     * Whether {@code INSERT ... RETURNING *} yields the written row.
     */
    public abstract boolean supportsReturning();

    /**
     * Condition selecting the row written by the last insert on this connection. Only needed when
     * {@link #supportsReturning()} is false and the primary key was generated by the database.
     */
    public SqlFragment lastInserted(String qualifier) {
        throw new UnsupportedOperationException(name + " does not track the last inserted row");
    }

    public String orderTerm(String expression, SortOrder order, NullsOrder nulls) {
        String term = expression + " " + order.name();
        return switch (nulls) {
            case FIRST -> term + " NULLS FIRST";
            case LAST -> term + " NULLS LAST";
            case DEFAULT -> term;
        };
    }

    /**
     * Renders {@code contains}, {@code startsWith} or {@code endsWith} on a string column.
     */
    public abstract SqlFragment match(String column, Operator op, String value, QueryMode mode);

    /**
     * Renders an operator on a JSON column. {@code path} is empty for the document root.
     */
    public abstract SqlFragment json(String column, Operator op, List<String> path, Object operand);

    public abstract void bind(PreparedStatement stmt, int index, SqlParam param) throws SQLException;

    /**
     * Reads column {@code index} as the Java type backing {@code type}; null for SQL NULL.
     */
    public abstract Object read(ResultSet rs, int index, ScalarType type) throws SQLException;

    /**
     * LIKE pattern for a text operator with {@code \} as the escape character.
     */
    protected static String likePattern(Operator op, String value) {
        String escaped = value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return switch (op) {
            case STARTS_WITH, JSON_STRING_STARTS_WITH -> escaped + "%";
            case ENDS_WITH, JSON_STRING_ENDS_WITH -> "%" + escaped;
            default -> "%" + escaped + "%";
        };
    }

    protected static SqlParam text(String value) {
        return new SqlParam(value, ScalarType.STRING);
    }
}
