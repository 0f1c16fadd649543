package com.lensql.repositories.rdbms;

import com.lensql.core.meta.EntityRegistry;
import com.lensql.core.where.ConditionResolver;
import com.lensql.repositories.rdbms.fetch.CompositeRegistry;
import com.lensql.repositories.rdbms.query.RowReader;
import com.lensql.repositories.rdbms.query.RowWriter;
import com.lensql.repositories.rdbms.sql.SqlRenderer;

import java.util.concurrent.Executor;

/**
 * Everything a query builder needs to run, shared by all builders of one {@link LensClient}.
 */
public record QueryContext(
        EntityRegistry entities,
        CompositeRegistry registry,
        Dialect dialect,
        ColumnCodec codec,
        ConditionResolver conditions,
        StatementExecutor statements,
        TransactionManager transactions,
        Executor executor
) {
    /**
     * A fresh renderer; each statement needs its own alias sequence.
     */
    public SqlRenderer renderer() {
        return new SqlRenderer(dialect, codec);
    }

    public RowReader reader() {
        return new RowReader(this);
    }

    public RowWriter writer() {
        return new RowWriter(this);
    }
}
