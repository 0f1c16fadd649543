package com.lensql.repositories.rdbms.query;

import com.lensql.core.QueryValidationException;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.ScalarType;
import com.lensql.core.meta.TypeClass;
import com.lensql.repositories.rdbms.ColumnCodec;
import com.lensql.repositories.rdbms.Dialect;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Set;

public enum AggregateFunction {
    COUNT("COUNT", "_count"),
    SUM("SUM", "_sum"),
    AVG("AVG", "_avg"),
    MIN("MIN", "_min"),
    MAX("MAX", "_max");

    private static final Set<TypeClass> ORDERED = Set.of(TypeClass.NUMERIC, TypeClass.STRING, TypeClass.DATETIME);

    private final String sql;
    private final String prefix;

    AggregateFunction(String sql, String prefix) {
        this.sql = sql;
        this.prefix = prefix;
    }

    /**
     * Result key used when the caller gives no alias, e.g. {@code _sum_views}.
     */
    public String defaultAlias(FieldMetadata field) {
        return field == null ? prefix : prefix + "_" + field.name();
    }

    public String expression(String column) {
        return column == null ? sql + "(*)" : sql + "(" + column + ")";
    }

    void check(EntityMetadata entity, FieldMetadata field) {
        if (field == null) {
            return;
        }
        TypeClass typeClass = field.type().typeClass();
        boolean allowed = switch (this) {
            case COUNT -> true;
            case SUM, AVG -> typeClass == TypeClass.NUMERIC;
            case MIN, MAX -> ORDERED.contains(typeClass);
        };
        if (!allowed) {
            throw new QueryValidationException(name() + " cannot be applied to "
                    + entity.name() + "." + field.name() + " (" + field.type() + ")");
        }
    }

    Object read(Dialect dialect, ColumnCodec codec, ResultSet rs, int index, FieldMetadata field) throws SQLException {
        return switch (this) {
            case COUNT -> rs.getLong(index);
            case SUM -> dialect.read(rs, index, field.type().isInteger() ? ScalarType.I64 : ScalarType.F64);
            case AVG -> dialect.read(rs, index, ScalarType.F64);
            case MIN, MAX -> codec.read(rs, index, field);
        };
    }
}
