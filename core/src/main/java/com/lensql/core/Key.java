package com.lensql.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lensql.core.meta.ScalarType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A key value of any supported scalar type. Used wherever a row is addressed without knowing the
 * concrete key type at compile time: unique selectors, deferred lookups, relation fetches.
 *
 * <p>Equality is structural over the type tag and the value, so {@code Key.of(1)} and
 * {@code Key.of(1L)} are different keys.
 */
public final class Key {
    private static final Logger logger = LoggerFactory.getLogger(Key.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final Pattern TAGGED = Pattern.compile("^([A-Za-z][A-Za-z0-9]*)\\((.*)\\)$", Pattern.DOTALL);
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern UUID_FORM = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private final ScalarType type;
    private final Object value;

    private Key(ScalarType type, Object value) {
        this.type = type;
        this.value = Objects.requireNonNull(value, "key value");
    }

    public static Key of(byte value) {
        return new Key(ScalarType.I8, value);
    }

    public static Key of(short value) {
        return new Key(ScalarType.I16, value);
    }

    public static Key of(int value) {
        return new Key(ScalarType.I32, value);
    }

    public static Key of(long value) {
        return new Key(ScalarType.I64, value);
    }

    public static Key of(float value) {
        return new Key(ScalarType.F32, value);
    }

    public static Key of(double value) {
        return new Key(ScalarType.F64, value);
    }

    public static Key of(boolean value) {
        return new Key(ScalarType.BOOL, value);
    }

    public static Key of(String value) {
        return new Key(ScalarType.STRING, value);
    }

    public static Key of(UUID value) {
        return new Key(ScalarType.UUID, value);
    }

    public static Key of(Instant value) {
        return new Key(ScalarType.DATE_TIME, value);
    }

    public static Key of(LocalDateTime value) {
        return new Key(ScalarType.LOCAL_DATE_TIME, value);
    }

    public static Key of(LocalDate value) {
        return new Key(ScalarType.DATE, value);
    }

    public static Key of(LocalTime value) {
        return new Key(ScalarType.TIME, value);
    }

    public static Key of(JsonNode value) {
        return new Key(ScalarType.JSON, value);
    }

    /**
     * Wraps any supported Java value. A {@code Key} is returned as is.
     */
    public static Key from(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot build a key from null");
        }
        if (value instanceof Key key) return key;
        if (value instanceof Byte b) return of(b.byteValue());
        if (value instanceof Short s) return of(s.shortValue());
        if (value instanceof Integer i) return of(i.intValue());
        if (value instanceof Long l) return of(l.longValue());
        if (value instanceof Float f) return of(f.floatValue());
        if (value instanceof Double d) return of(d.doubleValue());
        if (value instanceof Boolean b) return of(b.booleanValue());
        if (value instanceof String s) return of(s);
        if (value instanceof Character c) return of(c.toString());
        if (value instanceof UUID u) return of(u);
        if (value instanceof Instant i) return of(i);
        if (value instanceof OffsetDateTime o) return of(o.toInstant());
        if (value instanceof ZonedDateTime z) return of(z.toInstant());
        if (value instanceof LocalDateTime l) return of(l);
        if (value instanceof LocalDate l) return of(l);
        if (value instanceof LocalTime l) return of(l);
        if (value instanceof JsonNode j) return of(j);
        if (value instanceof BigInteger b) {
            try {
                return of(b.longValueExact());
            } catch (ArithmeticException e) {
                throw new TypeConversionException(value, ScalarType.I64, e);
            }
        }
        if (value instanceof BigDecimal b) return of(b.doubleValue());
        throw new IllegalArgumentException("Unsupported key value type " + value.getClass().getName());
    }

    /**
     * Inverse of {@link #toBackendValue()}. Also accepts the JDBC temporal types drivers hand back.
     */
    public static Key fromBackendValue(Object raw) {
        if (raw instanceof Timestamp t) return of(t.toInstant());
        if (raw instanceof java.sql.Date d) return of(d.toLocalDate());
        if (raw instanceof java.sql.Time t) return of(t.toLocalTime());
        return from(raw);
    }

    /**
     * Parses the display or tagged form. Tagged strings such as {@code I32(42)} keep their type;
     * anything else is tried as I8, I16, I32, I64, F32, F64, boolean and UUID in that order,
     * falling back to a string key.
     */
    public static Key parse(String text) {
        Objects.requireNonNull(text, "text");
        Matcher tagged = TAGGED.matcher(text);
        if (tagged.matches()) {
            Optional<ScalarType> type = ScalarType.fromTag(tagged.group(1));
            if (type.isPresent() && type.get() != ScalarType.OPAQUE) {
                Optional<Key> key = parseAs(type.get(), tagged.group(2));
                if (key.isPresent()) {
                    return key.get();
                }
            }
        }

        if (INTEGER.matcher(text).matches()) {
            for (ScalarType width : new ScalarType[]{ScalarType.I8, ScalarType.I16, ScalarType.I32, ScalarType.I64}) {
                Optional<Key> key = parseAs(width, text);
                if (key.isPresent()) {
                    return key.get();
                }
            }
            logger.warn("Integer key '{}' does not fit in 64 bits, keeping it as a string", text);
            return of(text);
        }
        if (DECIMAL.matcher(text).matches()) {
            double d = Double.parseDouble(text);
            if (Double.isFinite(d)) {
                float f = (float) d;
                return (double) f == d ? of(f) : of(d);
            }
        }
        if (text.equals("true") || text.equals("false")) {
            return of(Boolean.parseBoolean(text));
        }
        if (UUID_FORM.matcher(text).matches()) {
            return of(UUID.fromString(text));
        }
        return of(text);
    }

    private static Optional<Key> parseAs(ScalarType type, String text) {
        try {
            return Optional.of(switch (type) {
                case I8 -> of(Byte.parseByte(text));
                case I16 -> of(Short.parseShort(text));
                case I32 -> of(Integer.parseInt(text));
                case I64 -> of(Long.parseLong(text));
                case F32 -> of(Float.parseFloat(text));
                case F64 -> of(Double.parseDouble(text));
                case STRING -> of(text);
                case BOOL -> {
                    if (!text.equals("true") && !text.equals("false")) {
                        throw new IllegalArgumentException("not a boolean: " + text);
                    }
                    yield of(Boolean.parseBoolean(text));
                }
                case UUID -> of(UUID.fromString(text));
                case DATE_TIME -> of(Instant.parse(text));
                case LOCAL_DATE_TIME -> of(LocalDateTime.parse(text));
                case DATE -> of(LocalDate.parse(text));
                case TIME -> of(LocalTime.parse(text));
                case JSON -> of(OBJECT_MAPPER.readTree(text));
                case OPAQUE -> throw new IllegalArgumentException("opaque keys cannot be parsed");
            });
        } catch (IllegalArgumentException | DateTimeParseException | JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public ScalarType type() {
        return type;
    }

    public Object value() {
        return value;
    }

    /**
     * The value handed to the driver layer. One-to-one with the key.
     */
    public Object toBackendValue() {
        return value;
    }

    /**
     * Converts this key to the given type, e.g. a string key to the UUID a table expects.
     *
     * @throws TypeConversionException when the value has no representation in the target type
     */
    public Key convertTo(ScalarType target) {
        if (target == type || target == ScalarType.OPAQUE) {
            return this;
        }
        try {
            return switch (target) {
                case I8 -> of((byte) integral(target, Byte.MIN_VALUE, Byte.MAX_VALUE));
                case I16 -> of((short) integral(target, Short.MIN_VALUE, Short.MAX_VALUE));
                case I32 -> of((int) integral(target, Integer.MIN_VALUE, Integer.MAX_VALUE));
                case I64 -> of(integral(target, Long.MIN_VALUE, Long.MAX_VALUE));
                case F32 -> of(value instanceof Number n ? n.floatValue() : Float.parseFloat(text(target)));
                case F64 -> of(value instanceof Number n ? n.doubleValue() : Double.parseDouble(text(target)));
                case STRING -> of(value instanceof JsonNode j && j.isTextual() ? j.asText() : toString());
                case BOOL -> toBool(target);
                case UUID -> of(UUID.fromString(text(target)));
                case DATE_TIME -> toInstant(target);
                case LOCAL_DATE_TIME -> toLocalDateTime(target);
                case DATE -> toLocalDate(target);
                case TIME -> toLocalTime(target);
                case JSON -> {
                    Object plain = value instanceof java.time.temporal.Temporal ? toString() : value;
                    JsonNode node = OBJECT_MAPPER.valueToTree(plain);
                    yield of(node);
                }
                case OPAQUE -> this;
            };
        } catch (IllegalArgumentException | DateTimeParseException | ArithmeticException e) {
            throw new TypeConversionException(value, target, e);
        }
    }

    /**
     * Converts to the primary-key type the registry reports for the entity. Without registry
     * information the raw backend value is returned.
     */
    public Object asValueFor(EntityTypeRegistry registry, String entity) {
        return registry.primaryKeyType(entity)
                .map(t -> convertTo(t).toBackendValue())
                .orElseGet(this::toBackendValue);
    }

    /**
     * Converts to the type of a specific field, typically a foreign key.
     */
    public Object asValueFor(EntityTypeRegistry registry, String entity, String field) {
        return registry.foreignKeyType(entity, field)
                .map(t -> convertTo(t).toBackendValue())
                .orElseGet(this::toBackendValue);
    }

    public String toTaggedString() {
        return type.tag() + "(" + this + ")";
    }

    @Override
    public String toString() {
        if (value instanceof JsonNode node) {
            return node.isTextual() ? node.asText() : node.toString();
        }
        return value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Key other)) return false;
        return type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    private long integral(ScalarType target, long min, long max) {
        long result;
        if (value instanceof Float || value instanceof Double) {
            double d = ((Number) value).doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw new TypeConversionException(value, target);
            }
            result = new BigDecimal(d).longValueExact();
        } else if (value instanceof Number n) {
            result = n.longValue();
        } else if (value instanceof String s) {
            result = Long.parseLong(s.trim());
        } else if (value instanceof Boolean b) {
            result = b ? 1 : 0;
        } else if (value instanceof Instant i) {
            result = i.toEpochMilli();
        } else {
            throw new TypeConversionException(value, target);
        }
        if (result < min || result > max) {
            throw new TypeConversionException(value, target);
        }
        return result;
    }

    private String text(ScalarType target) {
        if (value instanceof String s) return s.trim();
        if (value instanceof JsonNode j && j.isValueNode()) return j.asText();
        throw new TypeConversionException(value, target);
    }

    private Key toBool(ScalarType target) {
        if (value instanceof Number n && n.longValue() == n.doubleValue() && (n.longValue() == 0 || n.longValue() == 1)) {
            return of(n.longValue() == 1);
        }
        String s = text(target);
        if (s.equalsIgnoreCase("true")) return of(true);
        if (s.equalsIgnoreCase("false")) return of(false);
        throw new TypeConversionException(value, target);
    }

    private Key toInstant(ScalarType target) {
        if (value instanceof LocalDateTime l) return of(l.toInstant(ZoneOffset.UTC));
        if (value instanceof LocalDate d) return of(d.atStartOfDay().toInstant(ZoneOffset.UTC));
        if (value instanceof Long l) return of(Instant.ofEpochMilli(l));
        return of(OffsetDateTime.parse(text(target)).toInstant());
    }

    private Key toLocalDateTime(ScalarType target) {
        if (value instanceof Instant i) return of(LocalDateTime.ofInstant(i, ZoneOffset.UTC));
        if (value instanceof LocalDate d) return of(d.atStartOfDay());
        return of(LocalDateTime.parse(text(target)));
    }

    private Key toLocalDate(ScalarType target) {
        if (value instanceof Instant i) return of(LocalDate.ofInstant(i, ZoneOffset.UTC));
        if (value instanceof LocalDateTime l) return of(l.toLocalDate());
        return of(LocalDate.parse(text(target)));
    }

    private Key toLocalTime(ScalarType target) {
        if (value instanceof LocalDateTime l) return of(l.toLocalTime());
        if (value instanceof Instant i) return of(LocalTime.ofInstant(i, ZoneOffset.UTC));
        return of(LocalTime.parse(text(target)));
    }
}
