package com.lensql.repositories.rdbms.fetch;

import com.lensql.core.Row;
import com.lensql.core.where.RelationFilter;
import com.lensql.core.where.UniqueWhere;
import com.lensql.repositories.rdbms.Transaction;

import java.util.List;
import java.util.Optional;

/**
 * Loads rows of one entity on behalf of a relation, without the caller knowing anything about
 * that entity beyond its name.
 */
public interface EntityFetcher {

    /**
     * Rows whose {@code field} equals {@code value}, further narrowed, ordered and paginated by
     * {@code filter}. Nested includes of the filter are loaded too.
     */
    List<Row> fetchByField(Transaction tx, String field, Object value, RelationFilter filter);

    /**
     * Number of rows {@link #fetchByField} would match before pagination.
     */
    long countByField(Transaction tx, String field, Object value, RelationFilter filter);

    Optional<Row> findUnique(Transaction tx, UniqueWhere where);
}
