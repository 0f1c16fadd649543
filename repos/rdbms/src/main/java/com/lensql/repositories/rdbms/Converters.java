package com.lensql.repositories.rdbms;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lensql.core.Key;
import com.lensql.core.QueryValidationException;
import com.lensql.core.TypeConversionException;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.ScalarType;
import com.lensql.core.where.NumericMutation;

import java.time.temporal.Temporal;

/**
 * Utility methods for moving values between Java, the query model and JDBC.
 */
public interface Converters {
    ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * Converts a caller-supplied value to the Java type backing {@code type}. Keys are unwrapped,
     * anything a {@link Key} can hold is converted through it, JSON values become {@link JsonNode}s.
     *
     * @throws TypeConversionException if the value has no representation in {@code type}
     */
    static Object normalize(ScalarType type, Object value) {
        if (value == null) {
            return null;
        }
        if (type == ScalarType.OPAQUE) {
            return value instanceof Key key ? key.value() : value;
        }
        if (type == ScalarType.JSON) {
            return toJson(value instanceof Key key ? key.value() : value);
        }
        try {
            return Key.from(value).convertTo(type).value();
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException(value, type, e);
        }
    }

    static JsonNode toJson(Object value) {
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof Temporal) {
            return OBJECT_MAPPER.getNodeFactory().textNode(value.toString());
        }
        return OBJECT_MAPPER.valueToTree(value);
    }

    static JsonNode parseJson(String text) {
        if (text == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new TypeConversionException(text, ScalarType.JSON, e);
        }
    }

    static String jsonText(JsonNode node) {
        return node == null ? null : node.toString();
    }

    /**
     * Narrows an integer read from the driver to the width of {@code type}.
     */
    static Object narrow(long value, ScalarType type) {
        return switch (type) {
            case I8 -> (byte) value;
            case I16 -> (short) value;
            case I32 -> (int) value;
            default -> value;
        };
    }

    /**
     * Applies one arithmetic update to a current value.
     *
     * @throws QueryValidationException on division by zero or when the current value is null
     */
    static Object mutate(FieldMetadata field, Object current, NumericMutation mutation, Number amount) {
        if (current == null) {
            throw new QueryValidationException("Cannot " + mutation.name().toLowerCase() + " null field " + field.name());
        }
        if (mutation == NumericMutation.DIVIDE && amount.doubleValue() == 0) {
            throw new QueryValidationException("Division by zero on field " + field.name());
        }
        Number base = (Number) current;
        if (field.type().isInteger()) {
            long a = base.longValue();
            long b = amount.longValue();
            try {
                long result = switch (mutation) {
                    case INCREMENT -> Math.addExact(a, b);
                    case DECREMENT -> Math.subtractExact(a, b);
                    case MULTIPLY -> Math.multiplyExact(a, b);
                    case DIVIDE -> divideExact(a, b);
                };
                return Key.of(result).convertTo(field.type()).value();
            } catch (ArithmeticException | TypeConversionException e) {
                throw new QueryValidationException("Arithmetic overflow on field " + field.name(), e);
            }
        }
        double a = base.doubleValue();
        double b = amount.doubleValue();
        double result = switch (mutation) {
            case INCREMENT -> a + b;
            case DECREMENT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> a / b;
        };
        return field.type() == ScalarType.F32 ? (Object) (float) result : (Object) result;
    }

    /**
     * Truncating division that fails instead of wrapping on {@code Long.MIN_VALUE / -1}.
     */
    private static long divideExact(long a, long b) {
        if (a == Long.MIN_VALUE && b == -1) {
            throw new ArithmeticException("long overflow");
        }
        return a / b;
    }
}
