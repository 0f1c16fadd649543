package com.lensql.repositories.rdbms.query;

import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.where.WhereParam;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;

import java.util.List;
import java.util.Optional;

/**
 * Reads the first matching row. A negative take reads from the end of the ordering, so the row
 * returned is the last one.
 */
public class FindFirstQuery extends SelectQuery<Optional<Row>, FindFirstQuery> {

    public FindFirstQuery(QueryContext context, EntityMetadata entity, List<WhereParam> where) {
        super(context, entity, where);
    }

    @Override
    protected Optional<Row> run(Transaction tx) {
        Integer take = take();
        int limit = take == null || take > 0 ? 1 : Math.max(take, -1);
        List<Row> rows = context.reader().read(tx, entity, spec(limit));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
