package com.lensql.repositories.rdbms.query;

import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.where.SetParam;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;

import java.util.List;

/**
 * Inserts several rows in one transaction and returns how many were written.
 */
public class CreateManyQuery extends QueryBuilder<Long> {
    private final List<List<SetParam>> rows;

    public CreateManyQuery(QueryContext context, EntityMetadata entity, List<List<SetParam>> rows) {
        super(context, entity);
        this.rows = List.copyOf(rows);
    }

    @Override
    protected Long run(Transaction tx) {
        long created = 0;
        for (List<SetParam> row : rows) {
            new CreateQuery(context, entity, row).execIn(tx);
            created++;
        }
        return created;
    }

    @Override
    protected boolean writes() {
        return true;
    }
}
