package com.lensql.repositories.rdbms.query;

import com.lensql.core.meta.EntityMetadata;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base class of every query builder. A builder accumulates its parameters, then runs exactly once,
 * either on the client's executor via {@link #exec()} or inside a caller's transaction via
 * {@link #execIn(Transaction)}.
 *
 * @param <T> result type
 */
public abstract class QueryBuilder<T> {
    protected final QueryContext context;
    protected final EntityMetadata entity;
    private final AtomicBoolean consumed = new AtomicBoolean();

    protected QueryBuilder(QueryContext context, EntityMetadata entity) {
        this.context = context;
        this.entity = entity;
    }

    public EntityMetadata entity() {
        return entity;
    }

    /**
     * Runs the query asynchronously. Writes get their own transaction; reads run in autocommit.
     */
    public CompletableFuture<T> exec() {
        consume();
        return CompletableFuture.supplyAsync(() -> writes()
                ? context.transactions().inTransaction(this::run)
                : context.transactions().withConnection(this::run), context.executor());
    }

    /**
     * Runs the query synchronously on {@code tx}; the caller owns commit and rollback.
     */
    public T execIn(Transaction tx) {
        consume();
        return run(tx);
    }

    protected abstract T run(Transaction tx);

    /**
     * Whether the query modifies rows and therefore needs a transaction of its own.
     */
    protected abstract boolean writes();

    protected void checkNotConsumed() {
        if (consumed.get()) {
            throw new IllegalStateException("Query on " + entity.name() + " has already been executed");
        }
    }

    private void consume() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Query on " + entity.name() + " has already been executed");
        }
    }
}
