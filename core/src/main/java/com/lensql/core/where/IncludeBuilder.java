package com.lensql.core.where;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Accumulates a {@link RelationFilter}.
 */
public class IncludeBuilder {
    private final String relation;
    private final List<WhereParam> filters = new ArrayList<>();
    private final List<RelationFilter> includes = new ArrayList<>();
    private final List<OrderBy> orderBy = new ArrayList<>();
    private final List<String> select = new ArrayList<>();
    private Integer take;
    private Integer skip;
    private UniqueWhere cursor;
    private boolean includeCount;
    private boolean distinct;

    private IncludeBuilder(String relation) {
        this.relation = relation;
    }

    public static IncludeBuilder of(String relation) {
        return new IncludeBuilder(relation);
    }

    public IncludeBuilder where(WhereParam... params) {
        this.filters.addAll(Arrays.asList(params));
        return this;
    }

    public IncludeBuilder where(List<WhereParam> params) {
        this.filters.addAll(params);
        return this;
    }

    public IncludeBuilder include(RelationFilter nested) {
        this.includes.add(nested);
        return this;
    }

    public IncludeBuilder include(IncludeBuilder nested) {
        this.includes.add(nested.build());
        return this;
    }

    public IncludeBuilder orderBy(OrderBy order) {
        this.orderBy.add(order);
        return this;
    }

    public IncludeBuilder take(int take) {
        this.take = take;
        return this;
    }

    public IncludeBuilder skip(int skip) {
        this.skip = skip;
        return this;
    }

    public IncludeBuilder cursor(UniqueWhere cursor) {
        this.cursor = cursor;
        return this;
    }

    public IncludeBuilder select(String... fields) {
        this.select.addAll(Arrays.asList(fields));
        return this;
    }

    public IncludeBuilder withCount() {
        this.includeCount = true;
        return this;
    }

    public IncludeBuilder distinct() {
        this.distinct = true;
        return this;
    }

    public RelationFilter build() {
        return new RelationFilter(relation, filters, includes, take, skip, orderBy, cursor, select, includeCount, distinct);
    }
}
