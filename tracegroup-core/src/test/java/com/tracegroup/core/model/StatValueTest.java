package com.tracegroup.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatValueTest {

    @Test
    void intAndUint_shouldMatchOnNumericValue() {
        assertEquals(StatValue.ofInt(7).matchKey(), StatValue.ofUint(7).matchKey());
        assertNotEquals(StatValue.ofInt(7).matchKey(), StatValue.ofString("7").matchKey());
    }

    @Test
    void uint_shouldRenderUnsigned() {
        StatValue max = StatValue.ofUint(-1L);

        assertEquals("18446744073709551615", max.asString());
        assertEquals(-1L, max.intOrUintValue());
        assertTrue(max.isIntegral());
    }

    @Test
    void isTrue_shouldFollowNumericValue() {
        assertTrue(StatValue.ofBoolean(true).isTrue());
        assertFalse(StatValue.ofBoolean(false).isTrue());
        assertTrue(StatValue.ofDouble(0.5).isTrue());
        assertFalse(StatValue.ofString("true").isTrue());
    }

    @Test
    void intOrUintValue_onString_shouldThrow() {
        StatValue value = StatValue.ofString("train");

        assertThrows(IllegalStateException.class, value::intOrUintValue);
        assertFalse(value.isIntegral());
    }

    @Test
    void constructor_shouldRejectStringOnNumericKind() {
        assertThrows(IllegalArgumentException.class,
            () -> new StatValue(StatValue.Kind.INT, 1, 0.0, "1"));
        assertThrows(IllegalArgumentException.class,
            () -> new StatValue(StatValue.Kind.STRING, 0, 0.0, null));
    }
}
