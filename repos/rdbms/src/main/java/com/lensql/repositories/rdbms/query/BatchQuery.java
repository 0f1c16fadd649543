package com.lensql.repositories.rdbms.query;

import com.lensql.core.Row;
import com.lensql.repositories.rdbms.Transaction;

/**
 * One write of a batch, tagged with its kind so results can be told apart.
 */
public record BatchQuery(Kind kind, QueryBuilder<Row> query) {

    public enum Kind {
        INSERT,
        UPDATE,
        DELETE,
        UPSERT
    }

    public static BatchQuery insert(CreateQuery query) {
        return new BatchQuery(Kind.INSERT, query);
    }

    public static BatchQuery update(UpdateQuery query) {
        return new BatchQuery(Kind.UPDATE, query);
    }

    public static BatchQuery delete(DeleteQuery query) {
        return new BatchQuery(Kind.DELETE, query);
    }

    public static BatchQuery upsert(UpsertQuery query) {
        return new BatchQuery(Kind.UPSERT, query);
    }

    public BatchResult execIn(Transaction tx) {
        return new BatchResult(kind, query.execIn(tx));
    }
}
