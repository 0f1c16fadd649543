package com.lensql.repositories.rdbms.query;

import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.where.IncludeBuilder;
import com.lensql.core.where.OrderBy;
import com.lensql.core.where.RelationFilter;
import com.lensql.core.where.UniqueWhere;
import com.lensql.core.where.WhereParam;
import com.lensql.repositories.rdbms.QueryContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared state of the multi-row read builders.
 *
 * @param <T>    result type
 * @param <SELF> concrete builder type, returned by the fluent setters
 */
public abstract class SelectQuery<T, SELF extends SelectQuery<T, SELF>> extends QueryBuilder<T> {
    private final List<WhereParam> where = new ArrayList<>();
    private final List<OrderBy> orderBy = new ArrayList<>();
    private final List<String> select = new ArrayList<>();
    private final List<RelationFilter> includes = new ArrayList<>();
    private Integer take;
    private Integer skip;
    private UniqueWhere cursor;
    private boolean distinct;

    protected SelectQuery(QueryContext context, EntityMetadata entity, List<WhereParam> where) {
        super(context, entity);
        this.where.addAll(where);
    }

    @SuppressWarnings("unchecked")
    private SELF self() {
        checkNotConsumed();
        return (SELF) this;
    }

    public SELF where(WhereParam... params) {
        where.addAll(Arrays.asList(params));
        return self();
    }

    public SELF orderBy(OrderBy... orders) {
        orderBy.addAll(Arrays.asList(orders));
        return self();
    }

    public SELF take(int take) {
        this.take = take;
        return self();
    }

    public SELF skip(int skip) {
        this.skip = skip;
        return self();
    }

    public SELF cursor(UniqueWhere cursor) {
        this.cursor = cursor;
        return self();
    }

    public SELF select(String... fields) {
        select.addAll(Arrays.asList(fields));
        return self();
    }

    public SELF include(RelationFilter include) {
        includes.add(include);
        return self();
    }

    public SELF include(IncludeBuilder include) {
        return include(include.build());
    }

    public SELF distinct() {
        this.distinct = true;
        return self();
    }

    protected ReadSpec spec(Integer limit) {
        return new ReadSpec(context.conditions().resolve(entity, where), orderBy, limit, skip, cursor,
                select, includes, distinct);
    }

    protected Integer take() {
        return take;
    }

    @Override
    protected boolean writes() {
        return false;
    }
}
