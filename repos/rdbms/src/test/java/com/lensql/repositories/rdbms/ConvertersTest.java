package com.lensql.repositories.rdbms;

import com.fasterxml.jackson.databind.JsonNode;
import com.lensql.core.Key;
import com.lensql.core.QueryValidationException;
import com.lensql.core.TypeConversionException;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.ScalarType;
import com.lensql.core.where.NumericMutation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class ConvertersTest {
    private static final FieldMetadata VIEWS = new FieldMetadata("views", "views", ScalarType.I32, "i32", false, false, false);
    private static final FieldMetadata SCORE = new FieldMetadata("score", "score", ScalarType.F64, "f64", true, false, false);

    @Test
    public void normalizeUnwrapsKeys() {
        UUID id = UUID.randomUUID();

        assertEquals(id, Converters.normalize(ScalarType.UUID, Key.of(id)));
        assertEquals(id, Converters.normalize(ScalarType.UUID, id.toString()));
        assertEquals(42L, Converters.normalize(ScalarType.I64, 42));
        assertNull(Converters.normalize(ScalarType.STRING, null));
    }

    @Test
    public void normalizeRejectsUnrepresentableValues() {
        assertThrows(TypeConversionException.class, () -> Converters.normalize(ScalarType.UUID, "not-a-uuid"));
        assertThrows(TypeConversionException.class, () -> Converters.normalize(ScalarType.I8, 300));
    }

    @Test
    public void jsonValuesBecomeTrees() {
        JsonNode node = (JsonNode) Converters.normalize(ScalarType.JSON, Map.of("tags", List.of("a", "b")));

        assertEquals("b", node.get("tags").get(1).asText());
        assertEquals("\"2024-01-01T00:00:00Z\"",
                Converters.jsonText(Converters.toJson(Instant.parse("2024-01-01T00:00:00Z"))));
        assertNull(Converters.parseJson(null));
    }

    @Test
    public void malformedJsonIsAConversionError() {
        assertThrows(TypeConversionException.class, () -> Converters.parseJson("{not json"));
    }

    @Test
    public void integerMutationsKeepTheFieldWidth() {
        assertEquals(15, Converters.mutate(VIEWS, 10, NumericMutation.INCREMENT, 5));
        assertEquals(5, Converters.mutate(VIEWS, 10, NumericMutation.DECREMENT, 5));
        assertEquals(30, Converters.mutate(VIEWS, 10, NumericMutation.MULTIPLY, 3));
        assertEquals(3, Converters.mutate(VIEWS, 10, NumericMutation.DIVIDE, 3));
    }

    @Test
    public void floatMutationsDoNotTruncate() {
        assertEquals(2.5, Converters.mutate(SCORE, 5.0, NumericMutation.DIVIDE, 2));
    }

    @Test
    public void overflowIsRejected() {
        QueryValidationException thrown = assertThrows(QueryValidationException.class, () ->
                Converters.mutate(VIEWS, Integer.MAX_VALUE, NumericMutation.INCREMENT, 1));

        assertTrue(thrown.getMessage().contains("overflow"));
    }

    @Test
    public void dividingTheSmallestLongByMinusOneIsAnOverflow() {
        FieldMetadata counter = new FieldMetadata("counter", "counter", ScalarType.I64, "i64", false, false, false);

        QueryValidationException thrown = assertThrows(QueryValidationException.class, () ->
                Converters.mutate(counter, Long.MIN_VALUE, NumericMutation.DIVIDE, -1));

        assertTrue(thrown.getMessage().contains("overflow"));
        assertEquals(Long.MIN_VALUE / 2, Converters.mutate(counter, Long.MIN_VALUE, NumericMutation.DIVIDE, 2));
    }

    @Test
    public void divisionByZeroIsRejected() {
        assertThrows(QueryValidationException.class, () -> Converters.mutate(VIEWS, 10, NumericMutation.DIVIDE, 0));
        assertThrows(QueryValidationException.class, () -> Converters.mutate(SCORE, 1.0, NumericMutation.DIVIDE, 0.0));
    }

    @Test
    public void nullFieldsCannotBeMutated() {
        assertThrows(QueryValidationException.class, () -> Converters.mutate(SCORE, null, NumericMutation.INCREMENT, 1));
    }

    @Test
    public void narrowMatchesDeclaredWidth() {
        assertEquals((byte) 7, Converters.narrow(7, ScalarType.I8));
        assertEquals((short) 7, Converters.narrow(7, ScalarType.I16));
        assertEquals(7, Converters.narrow(7, ScalarType.I32));
        assertEquals(7L, Converters.narrow(7, ScalarType.I64));
    }
}
