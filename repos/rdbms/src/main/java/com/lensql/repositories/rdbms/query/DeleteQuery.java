package com.lensql.repositories.rdbms.query;

import com.lensql.core.NotFoundException;
import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.where.UniqueWhere;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;

/**
 * Deletes the row selected by a unique selector and returns it as it was.
 */
public class DeleteQuery extends QueryBuilder<Row> {
    private final UniqueWhere where;

    public DeleteQuery(QueryContext context, EntityMetadata entity, UniqueWhere where) {
        super(context, entity);
        this.where = where;
    }

    @Override
    protected Row run(Transaction tx) {
        Row existing = context.reader().findUnique(tx, entity, where).orElseThrow(() ->
                new NotFoundException("No record found to delete"));
        context.writer().delete(tx, entity, context.conditions().unique(entity, where));
        return existing;
    }

    @Override
    protected boolean writes() {
        return true;
    }
}
