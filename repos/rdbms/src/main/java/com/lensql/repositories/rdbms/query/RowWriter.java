package com.lensql.repositories.rdbms.query;

import com.fasterxml.uuid.Generators;
import com.lensql.core.ContractViolationException;
import com.lensql.core.NotFoundException;
import com.lensql.core.QueryValidationException;
import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.ScalarType;
import com.lensql.core.where.Condition;
import com.lensql.core.where.NumericMutation;
import com.lensql.core.where.Operator;
import com.lensql.core.where.QueryMode;
import com.lensql.core.where.SetParam;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.SqlTemplates;
import com.lensql.repositories.rdbms.Transaction;
import com.lensql.repositories.rdbms.sql.SqlFragment;
import com.lensql.repositories.rdbms.sql.SqlParam;
import com.lensql.repositories.rdbms.sql.SqlRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Executes INSERT, UPDATE and DELETE statements for one entity at a time. Values are keyed by
 * field name.
 */
public class RowWriter {
    private static final Logger logger = LoggerFactory.getLogger(RowWriter.class);

    private final QueryContext context;

    public RowWriter(QueryContext context) {
        this.context = context;
    }

    /**
     * Inserts a row and returns it as stored, including database defaults. A UUID primary key
     * left unset is generated.
     */
    public Row insert(Transaction tx, EntityMetadata entity, Map<String, Object> input) {
        FieldMetadata pk = entity.primaryKey();
        Map<String, Object> values = new LinkedHashMap<>(input);
        if (pk.type() == ScalarType.UUID && values.get(pk.name()) == null) {
            values.put(pk.name(), Generators.timeBasedGenerator().generate());
        }

        SqlRenderer renderer = context.renderer();
        List<String> columns = new ArrayList<>();
        List<SqlFragment> placeholders = new ArrayList<>();
        values.forEach((name, value) -> {
            FieldMetadata field = entity.requireField(name);
            columns.add(context.dialect().quote(field.columnName()));
            placeholders.add(renderer.param(field, value));
        });
        SqlFragment params = SqlFragment.join(", ", placeholders);

        Map<String, Object> ctx = new HashMap<>();
        ctx.put("table", renderer.table(entity));
        ctx.put("columns", String.join(", ", columns));
        ctx.put("values", params.sql());
        ctx.put("returning", entity.fields().stream()
                .map(f -> renderer.column(null, f))
                .collect(Collectors.joining(", ")));
        SqlFragment statement = new SqlFragment(SqlTemplates.apply(context.dialect().templates().insert(), ctx), params.params());

        if (context.dialect().supportsReturning()) {
            List<Row> rows = context.statements().query(tx, statement, rs -> context.codec().readRow(rs, entity.fields()));
            if (rows.isEmpty()) {
                throw new IllegalStateException("Insert into " + entity.tableName() + " returned no row");
            }
            return rows.get(0);
        }

        context.statements().update(tx, statement);
        Object key = values.get(pk.name());
        RowReader reader = context.reader();
        return (key != null ? reader.findByPrimaryKey(tx, entity, key) : reader.findLastInserted(tx, entity))
                .orElseThrow(() -> new NotFoundException("Inserted " + entity.name() + " row could not be read back"));
    }

    public long updateByPrimaryKey(Transaction tx, EntityMetadata entity, Object key, Map<String, Object> values) {
        if (values.isEmpty()) {
            return 0;
        }
        List<SetParam> assignments = new ArrayList<>();
        values.forEach((name, value) -> assignments.add(SetParam.assign(name, value)));
        Condition byKey = new Condition.Comparison(entity.primaryKey(), Operator.EQUALS, key, QueryMode.DEFAULT, List.of());
        return update(tx, entity, byKey, assignments);
    }

    /**
     * Updates every row matching {@code condition}. Only assignments and arithmetic are accepted;
     * arithmetic is evaluated by the database.
     */
    public long update(Transaction tx, EntityMetadata entity, Condition condition, List<SetParam> changes) {
        if (changes.isEmpty()) {
            return 0;
        }
        SqlRenderer renderer = context.renderer();
        String table = renderer.table(entity);
        List<SqlFragment> assignments = new ArrayList<>();
        for (SetParam change : changes) {
            assignments.add(assignment(renderer, entity, change));
        }
        SqlFragment set = SqlFragment.join(", ", assignments);
        SqlFragment where = renderer.render(condition, table);

        Map<String, Object> ctx = new HashMap<>();
        ctx.put("table", table);
        ctx.put("assignments", set.sql());
        ctx.put("where", where.sql());
        List<SqlParam> params = new ArrayList<>(set.params());
        params.addAll(where.params());
        String sql = SqlTemplates.apply(context.dialect().templates().update(), ctx);
        SqlFragment statement = new SqlFragment(sql, params);
        long affected = context.statements().update(tx, statement);
        logger.debug("Updated {} {} rows", affected, entity.name());
        return affected;
    }

    public long delete(Transaction tx, EntityMetadata entity, Condition condition) {
        SqlRenderer renderer = context.renderer();
        String table = renderer.table(entity);
        SqlFragment where = renderer.render(condition, table);

        Map<String, Object> ctx = new HashMap<>();
        ctx.put("table", table);
        ctx.put("where", where.sql());
        String sql = SqlTemplates.apply(context.dialect().templates().delete(), ctx);
        long affected = context.statements().update(tx, new SqlFragment(sql, where.params()));
        logger.debug("Deleted {} {} rows", affected, entity.name());
        return affected;
    }

    private SqlFragment assignment(SqlRenderer renderer, EntityMetadata entity, SetParam change) {
        if (change instanceof SetParam.Assign assign) {
            FieldMetadata field = entity.requireField(assign.field());
            return renderer.param(field, assign.value()).wrap(renderer.column(null, field) + " = ", "");
        }
        if (change instanceof SetParam.Mutate mutate) {
            FieldMetadata field = entity.requireField(mutate.field());
            if (!field.type().typeClass().supportsArithmetic()) {
                throw new ContractViolationException("Field " + entity.name() + "." + field.name() + " is not numeric");
            }
            if (mutate.mutation() == NumericMutation.DIVIDE && mutate.amount().doubleValue() == 0) {
                throw new QueryValidationException("Division by zero on field " + field.name());
            }
            String column = renderer.column(null, field);
            String op = switch (mutate.mutation()) {
                case INCREMENT -> " + ";
                case DECREMENT -> " - ";
                case MULTIPLY -> " * ";
                case DIVIDE -> " / ";
            };
            return renderer.param(field, mutate.amount()).wrap(column + " = " + column + op, "");
        }
        throw new ContractViolationException("Only field assignments and arithmetic can be applied to many rows, got " + change);
    }
}
