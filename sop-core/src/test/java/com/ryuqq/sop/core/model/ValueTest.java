package com.ryuqq.sop.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Value 닫힌 타입 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ValueTest {

    @Test
    void asText_NumberValue_UsesPlainNotation() {
        assertEquals("1250", Value.of(1250).asText());
        assertEquals("100000", Value.of(new BigDecimal("1E+5")).asText());
    }

    @Test
    void asText_BooleanValue_ReturnsLiteral() {
        assertEquals("true", Value.of(true).asText());
        assertEquals("false", Value.of(false).asText());
    }

    @Test
    void isTruthy_FollowsBooleanAndNullSemantics() {
        assertTrue(Value.of(true).isTruthy());
        assertFalse(Value.of(false).isTruthy());
        assertFalse(Value.nullValue().isTruthy());
        assertTrue(Value.of("x").isTruthy());
        assertTrue(Value.emptyMap().isTruthy());
    }

    @Test
    void map_PreservesInsertionOrderAndCopiesInput() {
        // Given
        Map<String, Value> source = new LinkedHashMap<>();
        source.put("b", Value.of(2));
        source.put("a", Value.of(1));

        // When
        Value.MapValue map = Value.map(source);
        source.put("c", Value.of(3));

        // Then
        assertEquals(List.of("b", "a"), new ArrayList<>(map.entries().keySet()));
        assertTrue(map.get("c").isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> map.entries().put("x", Value.of(0)));
    }

    @Test
    void with_AddsEntryWithoutMutatingOriginal() {
        // Given
        Value.MapValue original = Value.map(Map.of("unit", Value.of("4B")));

        // When
        Value.MapValue updated = original.with("priority", Value.of("high"));

        // Then
        assertEquals(1, original.entries().size());
        assertEquals("high", updated.get("priority").orElseThrow().asText());
        assertEquals("4B", updated.get("unit").orElseThrow().asText());
    }

    @Test
    void list_NullElement_ThrowsException() {
        List<Value> values = new ArrayList<>();
        values.add(null);
        assertThrows(IllegalArgumentException.class, () -> new Value.ListValue(values));
    }

    @Test
    void equals_StructurallyEqualMaps_AreEqual() {
        assertEquals(
            Value.map(Map.of("k", Value.list(List.of(Value.of(1), Value.of("a"))))),
            Value.map(Map.of("k", Value.list(List.of(Value.of(1), Value.of("a")))))
        );
    }
}
