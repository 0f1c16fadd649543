package com.lensql.repositories.rdbms.query;

import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.where.SetParam;
import com.lensql.core.where.WhereParam;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;

import java.util.List;

/**
 * Applies field assignments and arithmetic to every matching row; returns the affected count.
 */
public class UpdateManyQuery extends QueryBuilder<Long> {
    private final List<WhereParam> where;
    private final List<SetParam> changes;

    public UpdateManyQuery(QueryContext context, EntityMetadata entity, List<WhereParam> where, List<SetParam> changes) {
        super(context, entity);
        this.where = List.copyOf(where);
        this.changes = List.copyOf(changes);
    }

    @Override
    protected Long run(Transaction tx) {
        return context.writer().update(tx, entity, context.conditions().resolve(entity, where), changes);
    }

    @Override
    protected boolean writes() {
        return true;
    }
}
