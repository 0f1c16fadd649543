package com.lensql.generator.analyze;

import com.lensql.core.meta.Naming;
import com.lensql.core.meta.ScalarType;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps declared type names onto scalar types. Both the short primitive spellings and the usual Java
 * class names are recognised; {@code Option<T>} and {@code Optional<T>} mark the field nullable.
 */
public final class TypeNames {
    private static final Map<String, ScalarType> NAMES = new HashMap<>();

    static {
        register(ScalarType.I8, "i8", "u8", "byte", "Byte");
        register(ScalarType.I16, "i16", "u16", "short", "Short");
        register(ScalarType.I32, "i32", "u32", "int", "Integer");
        register(ScalarType.I64, "i64", "u64", "isize", "usize", "long", "Long");
        register(ScalarType.F32, "f32", "float", "Float");
        register(ScalarType.F64, "f64", "double", "Double", "Decimal", "BigDecimal");
        register(ScalarType.STRING, "String", "str", "&str", "Text");
        register(ScalarType.BOOL, "bool", "boolean", "Boolean");
        register(ScalarType.UUID, "Uuid", "UUID");
        register(ScalarType.DATE_TIME, "DateTime", "DateTimeUtc", "DateTimeWithTimeZone", "Instant", "OffsetDateTime");
        register(ScalarType.LOCAL_DATE_TIME, "NaiveDateTime", "LocalDateTime");
        register(ScalarType.DATE, "NaiveDate", "Date", "LocalDate");
        register(ScalarType.TIME, "NaiveTime", "Time", "LocalTime");
        register(ScalarType.JSON, "Json", "Value", "JsonValue", "JsonNode");
    }

    private TypeNames() {
    }

    private static void register(ScalarType type, String... names) {
        for (String name : names) {
            NAMES.put(name, type);
        }
    }

    public record ResolvedType(ScalarType type, String declaredType, boolean nullable) {
    }

    public static ResolvedType resolve(String declared) {
        String text = declared == null ? "" : declared.replace(" ", "");
        boolean nullable = false;
        while (isWrapper(text)) {
            nullable = true;
            text = text.substring(text.indexOf('<') + 1, text.length() - 1);
        }
        String base = text.contains("<") ? text.substring(0, text.indexOf('<')) : text;
        ScalarType type = NAMES.getOrDefault(Naming.lastSegment(base), ScalarType.OPAQUE);
        return new ResolvedType(type, text, nullable);
    }

    private static boolean isWrapper(String text) {
        if (!text.endsWith(">")) {
            return false;
        }
        String base = Naming.lastSegment(text.substring(0, Math.max(text.indexOf('<'), 0)));
        return base.equals("Option") || base.equals("Optional");
    }
}
