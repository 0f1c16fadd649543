package com.lensql.repositories.rdbms.query;

import com.lensql.core.where.Condition;
import com.lensql.core.where.OrderBy;
import com.lensql.core.where.RelationFilter;
import com.lensql.core.where.UniqueWhere;

import java.util.List;

/**
 * A fully resolved read: filter, ordering, pagination, projection and includes.
 *
 * @param take negative values read backwards from the end of the ordering
 * @param skip must not be negative
 */
public record ReadSpec(
        Condition condition,
        List<OrderBy> orderBy,
        Integer take,
        Integer skip,
        UniqueWhere cursor,
        List<String> select,
        List<RelationFilter> includes,
        boolean distinct
) {
    public ReadSpec {
        orderBy = List.copyOf(orderBy);
        select = List.copyOf(select);
        includes = List.copyOf(includes);
    }

    public static ReadSpec where(Condition condition) {
        return new ReadSpec(condition, List.of(), null, null, null, List.of(), List.of(), false);
    }
}
