package com.lensql.repos.sqlite;

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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * SQLite flavour of the runtime SQL.
 *
 * <p>Storage: instants are epoch milliseconds, local dates and times ISO-8601 text, UUIDs text,
 * booleans 0/1 and JSON documents text queried through the json1 functions. Case-sensitive string
 * matching uses GLOB since SQLite's LIKE ignores ASCII case.
 */
public class SQLiteDialect extends Dialect {

    public SQLiteDialect() {
        super("sqlite");
    }

    @Override
    public String unlimited() {
        return "-1";
    }

    @Override
    public boolean supportsReturning() {
        return false;
    }

    @Override
    public SqlFragment lastInserted(String qualifier) {
        return SqlFragment.of(qualifier + ".rowid = last_insert_rowid()");
    }

    @Override
    public SqlFragment match(String column, Operator op, String value, QueryMode mode) {
        if (mode == QueryMode.INSENSITIVE) {
            return SqlFragment.of("LOWER(" + column + ") LIKE LOWER(?) ESCAPE '\\'", text(likePattern(op, value)));
        }
        return SqlFragment.of(column + " GLOB ?", text(globPattern(op, value)));
    }

    @Override
    public SqlFragment json(String column, Operator op, List<String> path, Object operand) {
        String at = path(path);
        return switch (op) {
            case EQUALS -> equalsAt(column, at, Converters.normalize(ScalarType.JSON, operand));
            case NOT_EQUALS -> equalsAt(column, at, Converters.normalize(ScalarType.JSON, operand))
                    .wrap("NOT COALESCE(", ", 0)");
            case JSON_STRING_CONTAINS, JSON_STRING_STARTS_WITH, JSON_STRING_ENDS_WITH -> SqlFragment.of(
                    "(json_type(" + column + ", ?) = 'text' AND json_extract(" + column + ", ?) GLOB ?)",
                    text(at), text(at), text(globPattern(op, String.valueOf(operand))));
            case JSON_ARRAY_CONTAINS -> arrayContains(column, at, Converters.normalize(ScalarType.JSON, operand));
            case JSON_ARRAY_STARTS_WITH -> isArray(column, at, equalsAt(column, at + "[0]",
                    Converters.normalize(ScalarType.JSON, operand)));
            case JSON_ARRAY_ENDS_WITH -> isArray(column, at, equalsAt(column, at + "[#-1]",
                    Converters.normalize(ScalarType.JSON, operand)));
            case JSON_OBJECT_CONTAINS -> SqlFragment.of(
                    "(json_type(" + column + ", ?) = 'object' AND json_type(" + column + ", ?) IS NOT NULL)",
                    text(at), text(at + "." + quoteKey(String.valueOf(operand))));
            case JSON_NULL -> jsonNull(column, at, (JsonNullFilter) operand);
            default -> throw new ContractViolationException("Operator " + op + " does not apply to JSON");
        };
    }

    private SqlFragment equalsAt(String column, String at, Object operand) {
        JsonNode value = (JsonNode) operand;
        if (value.isNull()) {
            return SqlFragment.of("json_type(" + column + ", ?) = 'null'", text(at));
        }
        if (value.isContainerNode()) {
            return SqlFragment.of("json_extract(" + column + ", ?) = json(?)", text(at), text(Converters.jsonText(value)));
        }
        return SqlFragment.of("json_extract(" + column + ", ?) = ?", text(at), scalar(value));
    }

    private SqlFragment arrayContains(String column, String at, Object operand) {
        JsonNode value = (JsonNode) operand;
        List<JsonNode> elements = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(elements::add);
        } else {
            elements.add(value);
        }
        List<SqlFragment> checks = new ArrayList<>();
        for (JsonNode element : elements) {
            SqlFragment match = element.isContainerNode()
                    ? SqlFragment.of("e.value = json(?)", text(Converters.jsonText(element)))
                    : SqlFragment.of("e.value = ?", scalar(element));
            checks.add(SqlFragment.join("", List.of(
                    SqlFragment.of("EXISTS (SELECT 1 FROM json_each(" + column + ", ?) e WHERE ", text(at)),
                    match,
                    SqlFragment.of(")"))));
        }
        if (checks.isEmpty()) {
            return isArray(column, at, SqlFragment.TRUE);
        }
        return isArray(column, at, SqlFragment.join(" AND ", checks));
    }

    private SqlFragment isArray(String column, String at, SqlFragment inner) {
        return SqlFragment.join("", List.of(
                SqlFragment.of("(json_type(" + column + ", ?) = 'array' AND ", text(at)),
                inner,
                SqlFragment.of(")")));
    }

    private SqlFragment jsonNull(String column, String at, JsonNullFilter filter) {
        return switch (filter) {
            case DB_NULL -> SqlFragment.of(column + " IS NULL");
            case JSON_NULL -> SqlFragment.of("json_type(" + column + ", ?) = 'null'", text(at));
            case ANY_NULL -> SqlFragment.of("(" + column + " IS NULL OR json_type(" + column + ", ?) = 'null')", text(at));
        };
    }

    /**
     * json1 path for the given segments; numeric segments index arrays.
     */
    static String path(List<String> segments) {
        StringBuilder path = new StringBuilder("$");
        for (String segment : segments) {
            if (segment.matches("\\d+")) {
                path.append('[').append(segment).append(']');
            } else {
                path.append('.').append(quoteKey(segment));
            }
        }
        return path.toString();
    }

    private static String quoteKey(String key) {
        return "\"" + key.replace("\"", "\\\"") + "\"";
    }

    static String globPattern(Operator op, String value) {
        StringBuilder escaped = new StringBuilder();
        for (char c : value.toCharArray()) {
            switch (c) {
                case '*' -> escaped.append("[*]");
                case '?' -> escaped.append("[?]");
                case '[' -> escaped.append("[[]");
                default -> escaped.append(c);
            }
        }
        return switch (op) {
            case STARTS_WITH, JSON_STRING_STARTS_WITH -> escaped + "*";
            case ENDS_WITH, JSON_STRING_ENDS_WITH -> "*" + escaped;
            default -> "*" + escaped + "*";
        };
    }

    private static SqlParam scalar(JsonNode node) {
        if (node.isBoolean()) {
            return new SqlParam(node.booleanValue(), ScalarType.BOOL);
        }
        if (node.isIntegralNumber()) {
            return new SqlParam(node.longValue(), ScalarType.I64);
        }
        if (node.isNumber()) {
            return new SqlParam(node.doubleValue(), ScalarType.F64);
        }
        return text(node.asText());
    }

    @Override
    public void bind(PreparedStatement stmt, int index, SqlParam param) throws SQLException {
        Object value = param.value();
        if (value == null) {
            stmt.setNull(index, Types.NULL);
            return;
        }
        switch (param.type()) {
            case I8, I16, I32, I64 -> stmt.setLong(index, ((Number) value).longValue());
            case F32, F64 -> stmt.setDouble(index, ((Number) value).doubleValue());
            case BOOL -> stmt.setInt(index, (Boolean) value ? 1 : 0);
            case DATE_TIME -> stmt.setLong(index, ((Instant) value).toEpochMilli());
            case STRING, UUID, LOCAL_DATE_TIME, DATE, TIME -> stmt.setString(index, value.toString());
            case JSON -> stmt.setString(index, Converters.jsonText((JsonNode) value));
            case OPAQUE -> stmt.setObject(index, value);
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
                int value = rs.getInt(index);
                yield rs.wasNull() ? null : value != 0;
            }
            case STRING -> rs.getString(index);
            case UUID -> {
                String value = rs.getString(index);
                yield value == null ? null : UUID.fromString(value);
            }
            case DATE_TIME -> instant(rs.getObject(index));
            case LOCAL_DATE_TIME -> {
                String value = rs.getString(index);
                yield value == null ? null : LocalDateTime.parse(value);
            }
            case DATE -> {
                String value = rs.getString(index);
                yield value == null ? null : LocalDate.parse(value);
            }
            case TIME -> {
                String value = rs.getString(index);
                yield value == null ? null : LocalTime.parse(value);
            }
            case JSON -> Converters.parseJson(rs.getString(index));
            case OPAQUE -> rs.getObject(index);
        };
    }

    private static Instant instant(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number millis) {
            return Instant.ofEpochMilli(millis.longValue());
        }
        return Instant.parse(raw.toString());
    }
}
