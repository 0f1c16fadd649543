package com.lensql.core.where;

import java.util.List;

/**
 * Describes how to load one relation alongside a parent row: which related rows, in what order,
 * how many, which fields, and what to load beneath them.
 */
public record RelationFilter(
        String relation,
        List<WhereParam> filters,
        List<RelationFilter> includes,
        Integer take,
        Integer skip,
        List<OrderBy> orderBy,
        UniqueWhere cursor,
        List<String> select,
        boolean includeCount,
        boolean distinct
) {
    public RelationFilter {
        filters = List.copyOf(filters);
        includes = List.copyOf(includes);
        orderBy = List.copyOf(orderBy);
        select = List.copyOf(select);
    }

    public static RelationFilter of(String relation) {
        return IncludeBuilder.of(relation).build();
    }
}
