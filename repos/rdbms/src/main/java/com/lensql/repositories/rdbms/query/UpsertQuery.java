package com.lensql.repositories.rdbms.query;

import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.where.SetParam;
import com.lensql.core.where.UniqueWhere;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;

import java.util.List;

/**
 * Updates the selected row with {@code update} when it exists, otherwise creates it from
 * {@code create} alone.
 */
public class UpsertQuery extends QueryBuilder<Row> {
    private final UniqueWhere where;
    private final List<SetParam> create;
    private final List<SetParam> update;

    public UpsertQuery(QueryContext context, EntityMetadata entity, UniqueWhere where,
                       List<SetParam> create, List<SetParam> update) {
        super(context, entity);
        this.where = where;
        this.create = List.copyOf(create);
        this.update = List.copyOf(update);
    }

    @Override
    protected Row run(Transaction tx) {
        if (context.reader().findUnique(tx, entity, where).isPresent()) {
            return new UpdateQuery(context, entity, where, update).execIn(tx);
        }
        return new CreateQuery(context, entity, create).execIn(tx);
    }

    @Override
    protected boolean writes() {
        return true;
    }
}
