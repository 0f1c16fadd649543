package com.lensql.repositories.rdbms.fetch;

import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.where.Condition;
import com.lensql.core.where.Operator;
import com.lensql.core.where.QueryMode;
import com.lensql.core.where.RelationFilter;
import com.lensql.core.where.UniqueWhere;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;
import com.lensql.repositories.rdbms.query.ReadSpec;

import java.util.List;
import java.util.Optional;

/**
 * Fetcher reading straight from the entity's table. Registered for every entity unless the client
 * is told otherwise.
 */
public class TableFetcher implements EntityFetcher {
    private final QueryContext context;
    private final EntityMetadata entity;

    public TableFetcher(QueryContext context, EntityMetadata entity) {
        this.context = context;
        this.entity = entity;
    }

    @Override
    public List<Row> fetchByField(Transaction tx, String field, Object value, RelationFilter filter) {
        ReadSpec spec = new ReadSpec(
                matching(field, value, filter),
                filter.orderBy(),
                filter.take(),
                filter.skip(),
                filter.cursor(),
                filter.select(),
                filter.includes(),
                filter.distinct());
        return context.reader().read(tx, entity, spec);
    }

    @Override
    public long countByField(Transaction tx, String field, Object value, RelationFilter filter) {
        return context.reader().count(tx, entity, matching(field, value, filter));
    }

    @Override
    public Optional<Row> findUnique(Transaction tx, UniqueWhere where) {
        return context.reader().findUnique(tx, entity, where);
    }

    private Condition matching(String field, Object value, RelationFilter filter) {
        FieldMetadata key = entity.requireField(field);
        Condition join = new Condition.Comparison(key, Operator.EQUALS, value, QueryMode.DEFAULT, List.of());
        if (filter.filters().isEmpty()) {
            return join;
        }
        return new Condition.All(List.of(join, context.conditions().resolve(entity, filter.filters())));
    }
}
