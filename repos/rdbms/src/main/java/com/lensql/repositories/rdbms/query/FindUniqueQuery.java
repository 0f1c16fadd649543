package com.lensql.repositories.rdbms.query;

import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.where.IncludeBuilder;
import com.lensql.core.where.RelationFilter;
import com.lensql.core.where.UniqueWhere;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public class FindUniqueQuery extends QueryBuilder<Optional<Row>> {
    private final UniqueWhere where;
    private final List<String> select = new ArrayList<>();
    private final List<RelationFilter> includes = new ArrayList<>();

    public FindUniqueQuery(QueryContext context, EntityMetadata entity, UniqueWhere where) {
        super(context, entity);
        this.where = where;
    }

    public FindUniqueQuery select(String... fields) {
        checkNotConsumed();
        select.addAll(Arrays.asList(fields));
        return this;
    }

    public FindUniqueQuery include(RelationFilter include) {
        checkNotConsumed();
        includes.add(include);
        return this;
    }

    public FindUniqueQuery include(IncludeBuilder include) {
        return include(include.build());
    }

    @Override
    protected Optional<Row> run(Transaction tx) {
        ReadSpec spec = new ReadSpec(context.conditions().unique(entity, where), List.of(), null, null, null,
                select, includes, false);
        List<Row> rows = context.reader().read(tx, entity, spec);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    protected boolean writes() {
        return false;
    }
}
