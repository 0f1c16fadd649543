package com.lensql.repositories.rdbms.query;

import com.lensql.core.QueryValidationException;
import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.where.Condition;
import com.lensql.core.where.Operator;
import com.lensql.core.where.OrderBy;
import com.lensql.core.where.QueryMode;
import com.lensql.core.where.RelationFilter;
import com.lensql.core.where.SortOrder;
import com.lensql.core.where.UniqueWhere;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.SqlTemplates;
import com.lensql.repositories.rdbms.Transaction;
import com.lensql.repositories.rdbms.fetch.IncludeLoader;
import com.lensql.repositories.rdbms.sql.SqlFragment;
import com.lensql.repositories.rdbms.sql.SqlRenderer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Executes reads. Pagination rules:
 * <ul>
 *     <li>a negative skip is rejected, a take of zero reads nothing</li>
 *     <li>a negative take reverses the ordering (primary key when none is given), reads
 *     {@code |take|} rows and restores the requested order</li>
 *     <li>a cursor excludes its own row and continues in the direction its field is ordered by,
 *     ascending when the field is not part of the ordering</li>
 * </ul>
 */
public class RowReader {
    private final QueryContext context;

    public RowReader(QueryContext context) {
        this.context = context;
    }

    public List<Row> read(Transaction tx, EntityMetadata entity, ReadSpec spec) {
        if (spec.skip() != null && spec.skip() < 0) {
            throw new QueryValidationException("skip must be >= 0");
        }
        if (spec.take() != null && spec.take() == 0) {
            return new ArrayList<>();
        }
        spec.select().forEach(entity::requireField);

        boolean reverse = spec.take() != null && spec.take() < 0;
        List<OrderBy> orders = new ArrayList<>(spec.orderBy());
        List<Condition> conditions = new ArrayList<>();
        conditions.add(spec.condition());

        if (spec.cursor() != null) {
            conditions.add(cursor(entity, spec.cursor(), orders, reverse));
        }
        if (reverse) {
            if (orders.isEmpty()) {
                orders.add(OrderBy.asc(entity.primaryKey().name()));
            }
            orders = orders.stream().map(OrderBy::reverse).collect(Collectors.toList());
        }

        List<FieldMetadata> fields = spec.distinct() && !spec.select().isEmpty() && spec.includes().isEmpty()
                ? spec.select().stream().map(entity::requireField).toList()
                : entity.fields();

        Integer limit = spec.take() == null ? null : Math.abs(spec.take());
        Condition condition = conditions.size() == 1 ? conditions.get(0) : new Condition.All(conditions);
        List<Row> rows = select(tx, entity, fields, spec.distinct(), orders, limit, spec.skip(),
                (renderer, alias) -> renderer.render(condition, alias));

        if (reverse) {
            Collections.reverse(rows);
        }
        if (!spec.includes().isEmpty()) {
            new IncludeLoader(context.registry()).load(tx, entity, rows, spec.includes());
        }
        if (!spec.select().isEmpty()) {
            List<String> keep = new ArrayList<>(spec.select());
            spec.includes().stream().map(RelationFilter::relation).forEach(keep::add);
            keep.add(Row.COUNT);
            rows = rows.stream().map(r -> r.project(keep)).collect(Collectors.toList());
        }
        return rows;
    }

    public Optional<Row> findUnique(Transaction tx, EntityMetadata entity, UniqueWhere where) {
        Condition condition = context.conditions().unique(entity, where);
        return first(read(tx, entity, ReadSpec.where(condition)));
    }

    public Optional<Row> findByPrimaryKey(Transaction tx, EntityMetadata entity, Object key) {
        FieldMetadata pk = entity.primaryKey();
        Condition condition = new Condition.Comparison(pk, Operator.EQUALS, key, QueryMode.DEFAULT, List.of());
        return first(read(tx, entity, ReadSpec.where(condition)));
    }

    /**
     * Reads the row the connection inserted last, for databases that cannot return it directly.
     */
    public Optional<Row> findLastInserted(Transaction tx, EntityMetadata entity) {
        return first(select(tx, entity, entity.fields(), false, List.of(), null, null,
                (renderer, alias) -> renderer.dialect().lastInserted(alias)));
    }

    public long count(Transaction tx, EntityMetadata entity, Condition condition) {
        SqlRenderer renderer = context.renderer();
        String alias = renderer.nextAlias();
        SqlFragment where = renderer.render(condition, alias);

        Map<String, Object> ctx = new HashMap<>();
        ctx.put("table", renderer.table(entity));
        ctx.put("alias", alias);
        ctx.put("where", where.sql());
        String sql = SqlTemplates.apply(context.dialect().templates().count(), ctx);
        return context.statements().queryLong(tx, new SqlFragment(sql, where.params()));
    }

    private Condition cursor(EntityMetadata entity, UniqueWhere cursor, List<OrderBy> orders, boolean reverse) {
        context.conditions().unique(entity, cursor);
        FieldMetadata field = entity.requireField(cursor.field());
        SortOrder direction = orders.stream()
                .filter(o -> o.field().equals(field.name()))
                .map(OrderBy::order)
                .findFirst()
                .orElse(null);
        if (direction == null) {
            direction = SortOrder.ASC;
            orders.add(OrderBy.asc(field.name()));
        }
        SortOrder effective = reverse ? direction.reverse() : direction;
        Operator op = effective == SortOrder.ASC ? Operator.GT : Operator.LT;
        return new Condition.Comparison(field, op, cursor.key(), QueryMode.DEFAULT, List.of());
    }

    private List<Row> select(Transaction tx, EntityMetadata entity, List<FieldMetadata> fields, boolean distinct,
                             List<OrderBy> orders, Integer limit, Integer offset,
                             WhereRenderer whereRenderer) {
        SqlRenderer renderer = context.renderer();
        String alias = renderer.nextAlias();
        SqlFragment where = whereRenderer.render(renderer, alias);

        Map<String, Object> ctx = new HashMap<>();
        ctx.put("distinct", distinct);
        ctx.put("columns", fields.stream().map(f -> renderer.column(alias, f)).collect(Collectors.joining(", ")));
        ctx.put("table", renderer.table(entity));
        ctx.put("alias", alias);
        ctx.put("where", where.sql());
        if (!orders.isEmpty()) {
            ctx.put("orderBy", renderer.orderBy(entity, orders, alias));
        }
        if (limit != null) {
            ctx.put("limit", String.valueOf(limit));
        }
        if (offset != null && offset > 0) {
            ctx.put("offset", String.valueOf(offset));
            ctx.putIfAbsent("limit", context.dialect().unlimited());
        }

        String sql = SqlTemplates.apply(context.dialect().templates().select(), ctx);
        return context.statements().query(tx, new SqlFragment(sql, where.params()),
                rs -> context.codec().readRow(rs, fields));
    }

    @FunctionalInterface
    private interface WhereRenderer {
        SqlFragment render(SqlRenderer renderer, String alias);
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
