package com.lensql.repositories.rdbms.query;

import com.lensql.core.NotFoundException;
import com.lensql.core.Row;
import com.lensql.core.where.UniqueWhere;
import com.lensql.repositories.rdbms.Transaction;

import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * A related row referenced by a unique selector whose key is only known once the lookup has run.
 * Lookups run in the order they were queued, on the write's own transaction, right before the
 * write executes.
 *
 * @param entity     entity the selector applies to
 * @param selector   unique selector of the related row
 * @param resolver   loads the related row
 * @param assignment copies what the write needs from the related row into the pending values
 */
public record DeferredLookup(
        String entity,
        UniqueWhere selector,
        Resolver resolver,
        BiConsumer<Map<String, Object>, Row> assignment
) {

    @FunctionalInterface
    public interface Resolver {
        Optional<Row> resolve(Transaction tx, UniqueWhere selector);
    }

    public void apply(Transaction tx, Map<String, Object> values) {
        Row row = resolver.resolve(tx, selector).orElseThrow(() -> new NotFoundException(
                "No " + entity + " found where " + selector.field() + " = " + selector.key()));
        assignment.accept(values, row);
    }
}
