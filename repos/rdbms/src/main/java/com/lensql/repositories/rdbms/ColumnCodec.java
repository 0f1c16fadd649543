package com.lensql.repositories.rdbms;

import com.lensql.core.Key;
import com.lensql.core.Row;
import com.lensql.core.ValueConverter;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.ScalarType;
import com.lensql.repositories.rdbms.sql.SqlParam;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Turns field values into bound parameters and result-set columns back into field values,
 * consulting user converters for opaque column types.
 */
public class ColumnCodec {
    private final Dialect dialect;
    private final Map<String, ValueConverter> converters;

    public ColumnCodec(Dialect dialect, Map<String, ValueConverter> converters) {
        this.dialect = dialect;
        this.converters = Map.copyOf(converters);
    }

    public SqlParam param(FieldMetadata field, Object value) {
        if (field.type() == ScalarType.OPAQUE) {
            Object plain = value instanceof Key key ? key.value() : value;
            ValueConverter converter = converters.get(field.declaredType());
            return new SqlParam(converter == null || plain == null ? plain : converter.toBackend(plain), ScalarType.OPAQUE);
        }
        return new SqlParam(Converters.normalize(field.type(), value), field.type());
    }

    /**
     * A parameter without field information, typed after its Java class.
     */
    public SqlParam param(Object value) {
        if (value == null) {
            return new SqlParam(null, ScalarType.OPAQUE);
        }
        if (value instanceof Key key) {
            return new SqlParam(key.value(), key.type());
        }
        try {
            Key key = Key.from(value);
            return new SqlParam(key.value(), key.type());
        } catch (IllegalArgumentException e) {
            return new SqlParam(value, ScalarType.OPAQUE);
        }
    }

    public Object read(ResultSet rs, int index, FieldMetadata field) throws SQLException {
        Object value = dialect.read(rs, index, field.type());
        if (field.type() == ScalarType.OPAQUE && value != null) {
            ValueConverter converter = converters.get(field.declaredType());
            return converter == null ? value : converter.fromBackend(value);
        }
        return value;
    }

    /**
     * Reads the current row; column {@code i + 1} holds {@code fields.get(i)}.
     */
    public Row readRow(ResultSet rs, List<FieldMetadata> fields) throws SQLException {
        Row row = new Row();
        for (int i = 0; i < fields.size(); i++) {
            row.put(fields.get(i).name(), read(rs, i + 1, fields.get(i)));
        }
        return row;
    }

    /**
     * Reads the current row of a statement the runtime did not generate, keyed by column label.
     */
    public Row readRaw(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Row row = new Row();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            row.put(meta.getColumnLabel(i), rs.getObject(i));
        }
        return row;
    }
}
