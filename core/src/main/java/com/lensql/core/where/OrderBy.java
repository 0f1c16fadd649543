package com.lensql.core.where;

public record OrderBy(String field, SortOrder order, NullsOrder nulls) {

    public static OrderBy asc(String field) {
        return new OrderBy(field, SortOrder.ASC, NullsOrder.DEFAULT);
    }

    public static OrderBy desc(String field) {
        return new OrderBy(field, SortOrder.DESC, NullsOrder.DEFAULT);
    }

    public OrderBy nullsFirst() {
        return new OrderBy(field, order, NullsOrder.FIRST);
    }

    public OrderBy nullsLast() {
        return new OrderBy(field, order, NullsOrder.LAST);
    }

    public OrderBy reverse() {
        return new OrderBy(field, order.reverse(), nulls.reverse());
    }
}
