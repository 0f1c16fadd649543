package com.lensql.core.meta;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Column value types understood by the runtime. Each type belongs to exactly one {@link TypeClass}.
 */
public enum ScalarType {
    I8(TypeClass.NUMERIC, "Byte", "I8"),
    I16(TypeClass.NUMERIC, "Short", "I16"),
    I32(TypeClass.NUMERIC, "Integer", "I32"),
    I64(TypeClass.NUMERIC, "Long", "I64"),
    F32(TypeClass.NUMERIC, "Float", "F32"),
    F64(TypeClass.NUMERIC, "Double", "F64"),
    STRING(TypeClass.STRING, "String", "String"),
    BOOL(TypeClass.BOOLEAN, "Boolean", "Bool"),
    UUID(TypeClass.UUID, "java.util.UUID", "Uuid"),
    DATE_TIME(TypeClass.DATETIME, "java.time.Instant", "DateTime"),
    LOCAL_DATE_TIME(TypeClass.DATETIME, "java.time.LocalDateTime", "LocalDateTime"),
    DATE(TypeClass.DATETIME, "java.time.LocalDate", "Date"),
    TIME(TypeClass.DATETIME, "java.time.LocalTime", "Time"),
    JSON(TypeClass.JSON, "com.fasterxml.jackson.databind.JsonNode", "Json"),
    OPAQUE(TypeClass.OPAQUE, "Object", "Opaque");

    private static final Map<String, ScalarType> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ScalarType::tag, Function.identity()));

    private final TypeClass typeClass;
    private final String javaType;
    private final String tag;

    ScalarType(TypeClass typeClass, String javaType, String tag) {
        this.typeClass = typeClass;
        this.javaType = javaType;
        this.tag = tag;
    }

    public TypeClass typeClass() {
        return typeClass;
    }

    /**
     * Boxed Java type used for values of this type, fully qualified outside {@code java.lang}.
     */
    public String javaType() {
        return javaType;
    }

    /**
     * Name used by the tagged key form, e.g. {@code I32(42)}.
     */
    public String tag() {
        return tag;
    }

    public boolean isInteger() {
        return this == I8 || this == I16 || this == I32 || this == I64;
    }

    public boolean isFloating() {
        return this == F32 || this == F64;
    }

    public static Optional<ScalarType> fromTag(String tag) {
        return Optional.ofNullable(BY_TAG.get(tag));
    }
}
