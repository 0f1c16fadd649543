package com.lensql.repositories.rdbms.sql;

import com.lensql.core.ContractViolationException;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.ScalarType;
import com.lensql.core.where.Condition;
import com.lensql.core.where.Operator;
import com.lensql.core.where.OrderBy;
import com.lensql.core.where.QueryMode;
import com.lensql.repositories.rdbms.ColumnCodec;
import com.lensql.repositories.rdbms.Dialect;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Renders condition trees and orderings to SQL for one statement. Table aliases are handed out
 * as {@code t0}, {@code t1}, ... so a renderer must not be shared between statements.
 */
public class SqlRenderer {
    private final Dialect dialect;
    private final ColumnCodec codec;
    private int aliases;

    public SqlRenderer(Dialect dialect, ColumnCodec codec) {
        this.dialect = dialect;
        this.codec = codec;
    }

    public Dialect dialect() {
        return dialect;
    }

    public String nextAlias() {
        return "t" + aliases++;
    }

    public String table(EntityMetadata entity) {
        return dialect.quote(entity.tableName());
    }

    /**
     * Column reference, qualified unless {@code qualifier} is null.
     */
    public String column(String qualifier, FieldMetadata field) {
        return column(qualifier, field.columnName());
    }

    public String column(String qualifier, String columnName) {
        String quoted = dialect.quote(columnName);
        return qualifier == null ? quoted : qualifier + "." + quoted;
    }

    public SqlFragment param(FieldMetadata field, Object value) {
        SqlParam param = codec.param(field, value);
        return SqlFragment.of(dialect.placeholder(param.type()), param);
    }

    public SqlFragment render(Condition condition, String qualifier) {
        if (condition instanceof Condition.All all) {
            return combine(all.conditions(), " AND ", SqlFragment.TRUE, qualifier);
        }
        if (condition instanceof Condition.Any any) {
            return combine(any.conditions(), " OR ", SqlFragment.FALSE, qualifier);
        }
        if (condition instanceof Condition.Not not) {
            return render(not.condition(), qualifier).wrap("NOT (", ")");
        }
        if (condition instanceof Condition.Constant constant) {
            return constant.value() ? SqlFragment.TRUE : SqlFragment.FALSE;
        }
        if (condition instanceof Condition.Comparison comparison) {
            return comparison(comparison, qualifier);
        }
        if (condition instanceof Condition.Exists exists) {
            return exists(exists, qualifier);
        }
        throw new ContractViolationException("Unsupported condition " + condition);
    }

    private SqlFragment combine(List<Condition> conditions, String separator, SqlFragment empty, String qualifier) {
        if (conditions.isEmpty()) {
            return empty;
        }
        List<SqlFragment> parts = new ArrayList<>();
        for (Condition condition : conditions) {
            parts.add(render(condition, qualifier).wrap("(", ")"));
        }
        return SqlFragment.join(separator, parts);
    }

    private SqlFragment exists(Condition.Exists exists, String qualifier) {
        String alias = nextAlias();
        SqlFragment filter = render(exists.filter(), alias);
        String join = column(alias, exists.innerColumn()) + " = " + column(qualifier, exists.outerColumn());
        String prefix = (exists.negated() ? "NOT " : "") + "EXISTS (SELECT 1 FROM "
                + dialect.quote(exists.targetTable()) + " " + alias + " WHERE " + join + " AND (";
        return filter.wrap(prefix, "))");
    }

    private SqlFragment comparison(Condition.Comparison comparison, String qualifier) {
        FieldMetadata field = comparison.field();
        String column = column(qualifier, field);
        Operator op = comparison.op();
        Object operand = comparison.operand();
        boolean insensitive = comparison.mode() == QueryMode.INSENSITIVE && field.type() == ScalarType.STRING;

        if (field.type() == ScalarType.JSON && (op.isJson()
                || (operand != null && (op == Operator.EQUALS || op == Operator.NOT_EQUALS)))) {
            return dialect.json(column, op, comparison.path(), operand);
        }
        return switch (op) {
            case EQUALS -> operand == null ? SqlFragment.of(column + " IS NULL") : compare(column, "=", field, operand, insensitive);
            case NOT_EQUALS -> operand == null ? SqlFragment.of(column + " IS NOT NULL") : compare(column, "<>", field, operand, insensitive);
            case GT -> compare(column, ">", field, operand, insensitive);
            case LT -> compare(column, "<", field, operand, insensitive);
            case GTE -> compare(column, ">=", field, operand, insensitive);
            case LTE -> compare(column, "<=", field, operand, insensitive);
            case IN -> in(column, "IN", field, operand, SqlFragment.FALSE);
            case NOT_IN -> in(column, "NOT IN", field, operand, SqlFragment.TRUE);
            case CONTAINS, STARTS_WITH, ENDS_WITH -> dialect.match(column, op, String.valueOf(operand), comparison.mode());
            case IS_NULL -> SqlFragment.of(column + " IS NULL");
            case IS_NOT_NULL -> SqlFragment.of(column + " IS NOT NULL");
            default -> throw new ContractViolationException("Operator " + op + " does not apply to " + field.name());
        };
    }

    private SqlFragment compare(String column, String sqlOp, FieldMetadata field, Object operand, boolean insensitive) {
        SqlFragment value = param(field, operand);
        if (insensitive) {
            return value.wrap("LOWER(" + column + ") " + sqlOp + " LOWER(", ")");
        }
        return value.wrap(column + " " + sqlOp + " ", "");
    }

    private SqlFragment in(String column, String sqlOp, FieldMetadata field, Object operand, SqlFragment empty) {
        if (!(operand instanceof Collection<?> values)) {
            throw new ContractViolationException(sqlOp + " on " + field.name() + " expects a list");
        }
        if (values.isEmpty()) {
            return empty;
        }
        List<SqlFragment> items = new ArrayList<>();
        for (Object value : values) {
            items.add(param(field, value));
        }
        return SqlFragment.join(", ", items).wrap(column + " " + sqlOp + " (", ")");
    }

    public String orderBy(EntityMetadata entity, List<OrderBy> orders, String qualifier) {
        List<String> terms = new ArrayList<>();
        for (OrderBy order : orders) {
            FieldMetadata field = entity.requireField(order.field());
            terms.add(dialect.orderTerm(column(qualifier, field), order.order(), order.nulls()));
        }
        return String.join(", ", terms);
    }
}
