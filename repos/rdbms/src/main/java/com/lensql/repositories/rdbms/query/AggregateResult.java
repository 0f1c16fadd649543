package com.lensql.repositories.rdbms.query;

import java.util.Map;

/**
 * Row count plus the requested per-field aggregates, keyed by field name. Aggregates over zero rows
 * are null.
 */
public record AggregateResult(
        long count,
        Map<String, Object> sum,
        Map<String, Object> avg,
        Map<String, Object> min,
        Map<String, Object> max
) {
}
