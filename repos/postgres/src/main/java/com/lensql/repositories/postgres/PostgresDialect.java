package com.lensql.repositories.postgres;

import com.fasterxml.jackson.databind.JsonNode;
import com.lensql.core.ContractViolationException;
import com.lensql.core.meta.ScalarType;
import com.lensql.core.where.JsonNullFilter;
import com.lensql.core.where.Operator;
import com.lensql.core.where.QueryMode;
import com.lensql.repositories.rdbms.Converters;
import com.lensql.repositories.rdbms.Dialect;
import com.lensql.repositories.rdbms.sql.SqlFragment;
import com.lensql.repositories.rdbms.sql.SqlParam;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * PostgreSQL flavour of the runtime SQL. JSON columns are {@code jsonb}; paths are bound as
 * {@code text[]} and walked with {@code #>}. Inserts return the written row.
 */
public class PostgresDialect extends Dialect {

    public PostgresDialect() {
        super("postgres");
    }

    @Override
    public String placeholder(ScalarType type) {
        return type == ScalarType.JSON ? "?::jsonb" : "?";
    }

    @Override
    public String unlimited() {
        return "ALL";
    }

    @Override
    public boolean supportsReturning() {
        return true;
    }

    @Override
    public SqlFragment match(String column, Operator op, String value, QueryMode mode) {
        String like = mode == QueryMode.INSENSITIVE ? " ILIKE " : " LIKE ";
        return SqlFragment.of(column + like + "? ESCAPE '\\'", text(likePattern(op, value)));
    }

    @Override
    public SqlFragment json(String column, Operator op, List<String> path, Object operand) {
        SqlFragment target = path.isEmpty()
                ? SqlFragment.of(column)
                : SqlFragment.of("(" + column + " #> ?::text[])", text(textArray(path)));
        return switch (op) {
            case EQUALS -> concat(target, SqlFragment.of(" = ?::jsonb", jsonParam(operand)));
            case NOT_EQUALS -> concat(target, SqlFragment.of(" = ?::jsonb", jsonParam(operand))).wrap("NOT COALESCE(", ", false)");
            case JSON_STRING_CONTAINS, JSON_STRING_STARTS_WITH, JSON_STRING_ENDS_WITH -> {
                SqlFragment value = path.isEmpty()
                        ? SqlFragment.of("(" + column + " #>> '{}')")
                        : SqlFragment.of("(" + column + " #>> ?::text[])", text(textArray(path)));
                yield typed(target, "string", concat(value,
                        SqlFragment.of(" LIKE ? ESCAPE '\\'", text(likePattern(op, String.valueOf(operand))))));
            }
            case JSON_ARRAY_CONTAINS -> {
                JsonNode value = (JsonNode) Converters.normalize(ScalarType.JSON, operand);
                JsonNode wrapped = value.isArray() ? value : Converters.OBJECT_MAPPER.createArrayNode().add(value);
                yield typed(target, "array", concat(target, SqlFragment.of(" @> ?::jsonb", jsonParam(wrapped))));
            }
            case JSON_ARRAY_STARTS_WITH -> typed(target, "array",
                    concat(target, SqlFragment.of(" -> 0 = ?::jsonb", jsonParam(operand))));
            case JSON_ARRAY_ENDS_WITH -> typed(target, "array",
                    concat(target, SqlFragment.of(" -> -1 = ?::jsonb", jsonParam(operand))));
            case JSON_OBJECT_CONTAINS -> typed(target, "object",
                    concat(target.wrap("jsonb_exists(", ", "), SqlFragment.of("?)", text(String.valueOf(operand)))));
            case JSON_NULL -> jsonNull(column, target, (JsonNullFilter) operand);
            default -> throw new ContractViolationException("Operator " + op + " does not apply to JSON");
        };
    }

    private SqlFragment jsonNull(String column, SqlFragment target, JsonNullFilter filter) {
        SqlFragment isJsonNull = target.wrap("jsonb_typeof(", ") = 'null'");
        return switch (filter) {
            case DB_NULL -> SqlFragment.of(column + " IS NULL");
            case JSON_NULL -> isJsonNull;
            case ANY_NULL -> isJsonNull.wrap("(" + column + " IS NULL OR ", ")");
        };
    }

    private static SqlFragment typed(SqlFragment target, String type, SqlFragment condition) {
        return concat(target.wrap("(jsonb_typeof(", ") = '" + type + "' AND "), condition.wrap("", ")"));
    }

    private static SqlFragment concat(SqlFragment first, SqlFragment second) {
        return SqlFragment.join("", List.of(first, second));
    }

    private static SqlParam jsonParam(Object operand) {
        return new SqlParam(Converters.normalize(ScalarType.JSON, operand), ScalarType.JSON);
    }

    /**
     * Postgres array literal of the path segments, e.g. {@code {"tags","0"}}.
     */
    static String textArray(List<String> segments) {
        return segments.stream()
                .map(s -> "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"")
                .collect(Collectors.joining(",", "{", "}"));
    }

    @Override
    public void bind(PreparedStatement stmt, int index, SqlParam param) throws SQLException {
        Object value = param.value();
        if (value == null) {
            stmt.setNull(index, Types.NULL);
            return;
        }
        switch (param.type()) {
            case I8, I16 -> stmt.setShort(index, ((Number) value).shortValue());
            case I32 -> stmt.setInt(index, ((Number) value).intValue());
            case I64 -> stmt.setLong(index, ((Number) value).longValue());
            case F32 -> stmt.setFloat(index, ((Number) value).floatValue());
            case F64 -> stmt.setDouble(index, ((Number) value).doubleValue());
            case BOOL -> stmt.setBoolean(index, (Boolean) value);
            case STRING -> stmt.setString(index, value.toString());
            case DATE_TIME -> stmt.setObject(index, OffsetDateTime.ofInstant((Instant) value, ZoneOffset.UTC));
            case UUID, LOCAL_DATE_TIME, DATE, TIME, OPAQUE -> stmt.setObject(index, value);
            case JSON -> stmt.setString(index, Converters.jsonText((JsonNode) value));
        }
    }

    @Override
    public Object read(ResultSet rs, int index, ScalarType type) throws SQLException {
        return switch (type) {
            case I8, I16, I32, I64 -> {
                long value = rs.getLong(index);
                yield rs.wasNull() ? null : Converters.narrow(value, type);
            }
            case F32 -> {
                float value = rs.getFloat(index);
                yield rs.wasNull() ? null : value;
            }
            case F64 -> {
                double value = rs.getDouble(index);
                yield rs.wasNull() ? null : value;
            }
            case BOOL -> {
                boolean value = rs.getBoolean(index);
                yield rs.wasNull() ? null : value;
            }
            case STRING -> rs.getString(index);
            case UUID -> rs.getObject(index, UUID.class);
            case DATE_TIME -> {
                OffsetDateTime value = rs.getObject(index, OffsetDateTime.class);
                yield value == null ? null : value.toInstant();
            }
            case LOCAL_DATE_TIME -> rs.getObject(index, LocalDateTime.class);
            case DATE -> rs.getObject(index, LocalDate.class);
            case TIME -> rs.getObject(index, LocalTime.class);
            case JSON -> Converters.parseJson(rs.getString(index));
            case OPAQUE -> rs.getObject(index);
        };
    }
}
