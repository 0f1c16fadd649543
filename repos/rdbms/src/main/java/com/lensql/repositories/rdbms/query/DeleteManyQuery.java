package com.lensql.repositories.rdbms.query;

import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.where.WhereParam;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;

import java.util.List;

public class DeleteManyQuery extends QueryBuilder<Long> {
    private final List<WhereParam> where;

    public DeleteManyQuery(QueryContext context, EntityMetadata entity, List<WhereParam> where) {
        super(context, entity);
        this.where = List.copyOf(where);
    }

    @Override
    protected Long run(Transaction tx) {
        return context.writer().delete(tx, entity, context.conditions().resolve(entity, where));
    }

    @Override
    protected boolean writes() {
        return true;
    }
}
