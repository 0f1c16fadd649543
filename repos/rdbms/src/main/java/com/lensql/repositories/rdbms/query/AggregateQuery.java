package com.lensql.repositories.rdbms.query;

import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.where.WhereParam;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.SqlTemplates;
import com.lensql.repositories.rdbms.Transaction;
import com.lensql.repositories.rdbms.sql.SqlFragment;
import com.lensql.repositories.rdbms.sql.SqlRenderer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the row count and sum/avg/min/max of chosen fields over the matching rows.
 */
public class AggregateQuery extends QueryBuilder<AggregateResult> {
    private final List<WhereParam> where;
    private final List<Selection> selections = new ArrayList<>();

    public AggregateQuery(QueryContext context, EntityMetadata entity, List<WhereParam> where) {
        super(context, entity);
        this.where = List.copyOf(where);
    }

    public AggregateQuery sum(String... fields) {
        return add(AggregateFunction.SUM, fields);
    }

    public AggregateQuery avg(String... fields) {
        return add(AggregateFunction.AVG, fields);
    }

    public AggregateQuery min(String... fields) {
        return add(AggregateFunction.MIN, fields);
    }

    public AggregateQuery max(String... fields) {
        return add(AggregateFunction.MAX, fields);
    }

    private AggregateQuery add(AggregateFunction function, String... fields) {
        checkNotConsumed();
        for (String name : fields) {
            FieldMetadata field = entity.requireField(name);
            function.check(entity, field);
            selections.add(new Selection(function, field));
        }
        return this;
    }

    @Override
    protected AggregateResult run(Transaction tx) {
        SqlRenderer renderer = context.renderer();
        String alias = renderer.nextAlias();
        SqlFragment whereSql = renderer.render(context.conditions().resolve(entity, where), alias);

        List<String> columns = new ArrayList<>();
        columns.add(AggregateFunction.COUNT.expression(null));
        for (Selection selection : selections) {
            columns.add(selection.function().expression(renderer.column(alias, selection.field())));
        }

        Map<String, Object> ctx = new HashMap<>();
        ctx.put("selections", String.join(", ", columns));
        ctx.put("table", renderer.table(entity));
        ctx.put("alias", alias);
        ctx.put("where", whereSql.sql());
        String sql = SqlTemplates.apply(context.dialect().templates().aggregate(), ctx);

        List<Row> rows = context.statements().query(tx, new SqlFragment(sql, whereSql.params()), rs -> {
            Row row = new Row();
            row.put(Row.COUNT, rs.getLong(1));
            for (int i = 0; i < selections.size(); i++) {
                Selection selection = selections.get(i);
                row.put(selection.key(), selection.function()
                        .read(context.dialect(), context.codec(), rs, i + 2, selection.field()));
            }
            return row;
        });

        Row row = rows.get(0);
        Map<AggregateFunction, Map<String, Object>> grouped = new HashMap<>();
        for (Selection selection : selections) {
            grouped.computeIfAbsent(selection.function(), f -> new LinkedHashMap<>())
                    .put(selection.field().name(), row.get(selection.key()));
        }
        return new AggregateResult(
                row.getLong(Row.COUNT),
                grouped.getOrDefault(AggregateFunction.SUM, Map.of()),
                grouped.getOrDefault(AggregateFunction.AVG, Map.of()),
                grouped.getOrDefault(AggregateFunction.MIN, Map.of()),
                grouped.getOrDefault(AggregateFunction.MAX, Map.of()));
    }

    @Override
    protected boolean writes() {
        return false;
    }

    private record Selection(AggregateFunction function, FieldMetadata field) {
        String key() {
            return function.defaultAlias(field);
        }
    }
}
