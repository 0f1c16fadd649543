package com.lensql.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lensql.core.meta.ScalarType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class KeyTest {

    @Test
    void equalityIsStructuralOverTypeAndValue() {
        assertEquals(Key.of(42), Key.of(42));
        assertEquals(Key.of(42).hashCode(), Key.of(42).hashCode());
        assertNotEquals(Key.of(42), Key.of(42L));
        assertNotEquals(Key.of("42"), Key.of(42));
    }

    @Test
    void backendValueRoundTripsForEveryVariant() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Key[] keys = {
                Key.of((byte) 1), Key.of((short) 2), Key.of(3), Key.of(4L),
                Key.of(1.5f), Key.of(2.25), Key.of("abc"), Key.of(true),
                Key.of(UUID.randomUUID()), Key.of(Instant.parse("2024-05-01T10:15:30Z")),
                Key.of(java.time.LocalDateTime.parse("2024-05-01T10:15:30")),
                Key.of(java.time.LocalDate.parse("2024-05-01")),
                Key.of(java.time.LocalTime.parse("10:15:30")),
                Key.of(mapper.readTree("{\"a\":[1,2]}"))
        };
        for (Key key : keys) {
            assertEquals(key, Key.fromBackendValue(key.toBackendValue()), key.toTaggedString());
        }
    }

    @Test
    void parsePrefersTheNarrowestIntegerWidth() {
        assertEquals(Key.of((byte) 42), Key.parse("42"));
        assertEquals(Key.of((short) 1000), Key.parse("1000"));
        assertEquals(Key.of(100000), Key.parse("100000"));
        assertEquals(Key.of(10000000000L), Key.parse("10000000000"));
    }

    @Test
    void parseFallsThroughFloatsBooleansUuidsAndStrings() {
        UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
        assertEquals(Key.of(1.5f), Key.parse("1.5"));
        assertEquals(Key.of(0.1), Key.parse("0.1"));
        assertEquals(Key.of(true), Key.parse("true"));
        assertEquals(Key.of(id), Key.parse(id.toString()));
        assertEquals(Key.of("hello"), Key.parse("hello"));
    }

    @Test
    void parseKeepsOversizedIntegersAsStrings() {
        Key key = Key.parse("99999999999999999999");
        assertEquals(ScalarType.STRING, key.type());
        assertEquals("99999999999999999999", key.toString());
    }

    @Test
    void taggedStringPreservesTheVariant() {
        Key key = Key.of(42);
        assertEquals("I32(42)", key.toTaggedString());
        assertEquals(key, Key.parse(key.toTaggedString()));
        assertEquals(Key.of("42"), Key.parse("String(42)"));
        assertEquals(Key.of(7L), Key.parse(Key.of(7L).toTaggedString()));
    }

    @Test
    void displayFormIsThePlainValue() {
        assertEquals("42", Key.of(42).toString());
        assertEquals("abc", Key.of("abc").toString());
    }

    @Test
    void convertsToTheRequestedType() {
        UUID id = UUID.randomUUID();
        assertEquals(Key.of(id), Key.of(id.toString()).convertTo(ScalarType.UUID));
        assertEquals(Key.of(5L), Key.of(5).convertTo(ScalarType.I64));
        assertEquals(Key.of(5), Key.of("5").convertTo(ScalarType.I32));
        assertEquals(Key.of("5"), Key.of(5).convertTo(ScalarType.STRING));
    }

    @Test
    void rejectsLossyConversions() {
        assertThrows(TypeConversionException.class, () -> Key.of(300).convertTo(ScalarType.I8));
        assertThrows(TypeConversionException.class, () -> Key.of(1.5).convertTo(ScalarType.I32));
        assertThrows(TypeConversionException.class, () -> Key.of("nope").convertTo(ScalarType.UUID));
    }

    @Test
    void asValueForUsesTheRegistryType() {
        assertEquals(7L, Key.of(7).asValueFor(Fixtures.REGISTRY, "User"));
        assertEquals(7L, Key.of("7").asValueFor(Fixtures.REGISTRY, "Post", "author_id"));
        assertEquals(7, Key.of(7).asValueFor(Fixtures.REGISTRY, "Unknown"));
    }
}
