package com.lensql.repositories.rdbms.query;

import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.where.WhereParam;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;

import java.util.List;

public class FindManyQuery extends SelectQuery<List<Row>, FindManyQuery> {

    public FindManyQuery(QueryContext context, EntityMetadata entity, List<WhereParam> where) {
        super(context, entity, where);
    }

    @Override
    protected List<Row> run(Transaction tx) {
        return context.reader().read(tx, entity, spec(take()));
    }
}
