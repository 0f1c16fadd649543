package com.lensql.repositories.rdbms.query;

import com.lensql.core.QueryValidationException;
import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.where.OrderBy;
import com.lensql.core.where.WhereParam;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.SqlTemplates;
import com.lensql.repositories.rdbms.Transaction;
import com.lensql.repositories.rdbms.sql.SqlFragment;
import com.lensql.repositories.rdbms.sql.SqlParam;
import com.lensql.repositories.rdbms.sql.SqlRenderer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups matching rows by one or more fields. Each result row holds the group's field values plus
 * the requested aggregates under their aliases ({@code _count}, {@code _sum_<field>}, ... unless
 * given explicitly). Ordering may name group fields or aggregate aliases.
 */
public class GroupByQuery extends QueryBuilder<List<Row>> {
    private final List<FieldMetadata> by;
    private final List<WhereParam> where;
    private final List<Selection> selections = new ArrayList<>();
    private final List<OrderBy> orderBy = new ArrayList<>();
    private String havingOp;
    private long havingCount;
    private int take = -1;
    private int skip;

    public GroupByQuery(QueryContext context, EntityMetadata entity, List<String> by, List<WhereParam> where) {
        super(context, entity);
        if (by.isEmpty()) {
            throw new QueryValidationException("groupBy needs at least one field");
        }
        this.by = by.stream().map(entity::requireField).toList();
        this.where = List.copyOf(where);
    }

    public GroupByQuery count() {
        return count(AggregateFunction.COUNT.defaultAlias(null));
    }

    public GroupByQuery count(String alias) {
        return add(AggregateFunction.COUNT, null, alias);
    }

    public GroupByQuery sum(String field) {
        return add(AggregateFunction.SUM, field, null);
    }

    public GroupByQuery sum(String field, String alias) {
        return add(AggregateFunction.SUM, field, alias);
    }

    public GroupByQuery avg(String field) {
        return add(AggregateFunction.AVG, field, null);
    }

    public GroupByQuery avg(String field, String alias) {
        return add(AggregateFunction.AVG, field, alias);
    }

    public GroupByQuery min(String field) {
        return add(AggregateFunction.MIN, field, null);
    }

    public GroupByQuery min(String field, String alias) {
        return add(AggregateFunction.MIN, field, alias);
    }

    public GroupByQuery max(String field) {
        return add(AggregateFunction.MAX, field, null);
    }

    public GroupByQuery max(String field, String alias) {
        return add(AggregateFunction.MAX, field, alias);
    }

    public GroupByQuery havingCountGt(long count) {
        return having(">", count);
    }

    public GroupByQuery havingCountLt(long count) {
        return having("<", count);
    }

    public GroupByQuery havingCountEq(long count) {
        return having("=", count);
    }

    public GroupByQuery orderBy(OrderBy... orders) {
        checkNotConsumed();
        orderBy.addAll(Arrays.asList(orders));
        return this;
    }

    /**
     * Negative values read nothing.
     */
    public GroupByQuery take(int take) {
        checkNotConsumed();
        this.take = Math.max(take, 0);
        return this;
    }

    /**
     * Negative values skip nothing.
     */
    public GroupByQuery skip(int skip) {
        checkNotConsumed();
        this.skip = Math.max(skip, 0);
        return this;
    }

    private GroupByQuery having(String op, long count) {
        checkNotConsumed();
        this.havingOp = op;
        this.havingCount = count;
        return this;
    }

    private GroupByQuery add(AggregateFunction function, String fieldName, String alias) {
        checkNotConsumed();
        FieldMetadata field = fieldName == null ? null : entity.requireField(fieldName);
        function.check(entity, field);
        selections.add(new Selection(function, field, alias == null ? function.defaultAlias(field) : alias));
        return this;
    }

    @Override
    protected List<Row> run(Transaction tx) {
        SqlRenderer renderer = context.renderer();
        String alias = renderer.nextAlias();
        SqlFragment whereSql = renderer.render(context.conditions().resolve(entity, where), alias);
        List<SqlParam> params = new ArrayList<>(whereSql.params());

        List<String> columns = new ArrayList<>();
        List<String> groups = new ArrayList<>();
        for (FieldMetadata field : by) {
            String column = renderer.column(alias, field);
            groups.add(column);
            columns.add(column + " AS " + context.dialect().quote(field.name()));
        }
        for (Selection selection : selections) {
            String column = selection.field() == null ? null : renderer.column(alias, selection.field());
            columns.add(selection.function().expression(column) + " AS " + context.dialect().quote(selection.alias()));
        }

        Map<String, Object> ctx = new HashMap<>();
        ctx.put("selections", String.join(", ", columns));
        ctx.put("table", renderer.table(entity));
        ctx.put("alias", alias);
        ctx.put("where", whereSql.sql());
        ctx.put("groupBy", String.join(", ", groups));
        if (havingOp != null) {
            SqlParam count = context.codec().param(havingCount);
            ctx.put("having", "COUNT(*) " + havingOp + " " + context.dialect().placeholder(count.type()));
            params.add(count);
        }
        if (!orderBy.isEmpty()) {
            ctx.put("orderBy", orderTerms(renderer, alias));
        }
        if (take >= 0) {
            ctx.put("limit", String.valueOf(take));
        }
        if (skip > 0) {
            ctx.put("offset", String.valueOf(skip));
            ctx.putIfAbsent("limit", context.dialect().unlimited());
        }
        String sql = SqlTemplates.apply(context.dialect().templates().groupBy(), ctx);

        return context.statements().query(tx, new SqlFragment(sql, params), rs -> {
            Row row = new Row();
            int index = 1;
            for (FieldMetadata field : by) {
                row.put(field.name(), context.codec().read(rs, index++, field));
            }
            for (Selection selection : selections) {
                row.put(selection.alias(), selection.function()
                        .read(context.dialect(), context.codec(), rs, index++, selection.field()));
            }
            return row;
        });
    }

    private String orderTerms(SqlRenderer renderer, String alias) {
        List<String> terms = new ArrayList<>();
        for (OrderBy order : orderBy) {
            String expression = selections.stream()
                    .filter(s -> s.alias().equals(order.field()))
                    .findFirst()
                    .map(s -> context.dialect().quote(s.alias()))
                    .orElseGet(() -> renderer.column(alias, entity.requireField(order.field())));
            terms.add(context.dialect().orderTerm(expression, order.order(), order.nulls()));
        }
        return String.join(", ", terms);
    }

    @Override
    protected boolean writes() {
        return false;
    }

    private record Selection(AggregateFunction function, FieldMetadata field, String alias) {
    }
}
