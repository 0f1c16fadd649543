package com.lensql.core;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A result row keyed by field name. Included relations are stored under the relation name, either
 * as a {@link Row}, a list of rows or null; include counts live in a nested row under {@link #COUNT}.
 */
public class Row extends LinkedHashMap<String, Object> {
    private static final long serialVersionUID = 1L;

    public static final String COUNT = "_count";

    public Row() {
        super();
    }

    public Row(Map<String, ?> values) {
        super(values);
    }

    public static Row of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Row.of expects key/value pairs");
        }
        Row row = new Row();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    public <T> T get(String key, Class<T> type) {
        Object value = get(key);
        return value == null ? null : type.cast(value);
    }

    public String getString(String key) {
        Object value = get(key);
        return value == null ? null : value.toString();
    }

    public Long getLong(String key) {
        Object value = get(key);
        return value == null ? null : ((Number) value).longValue();
    }

    public Integer getInt(String key) {
        Object value = get(key);
        return value == null ? null : ((Number) value).intValue();
    }

    public Double getDouble(String key) {
        Object value = get(key);
        return value == null ? null : ((Number) value).doubleValue();
    }

    public Boolean getBoolean(String key) {
        return get(key, Boolean.class);
    }

    public UUID getUuid(String key) {
        return get(key, UUID.class);
    }

    public Row getRow(String relation) {
        return get(relation, Row.class);
    }

    @SuppressWarnings("unchecked")
    public List<Row> getRows(String relation) {
        return (List<Row>) get(relation);
    }

    /**
     * Related-row count recorded by an include with counting enabled.
     */
    public Long count(String relation) {
        Row counts = getRow(COUNT);
        return counts == null ? null : counts.getLong(relation);
    }

    public Row project(Collection<String> keys) {
        Row projected = new Row();
        for (String key : keys) {
            if (containsKey(key)) {
                projected.put(key, get(key));
            }
        }
        return projected;
    }
}
