package de.bsommerfeld.nestedsets.core.boundary;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoundariesTest {

    @Test
    void constructor_shouldRejectInvalidPairs() {
        assertThrows(IllegalArgumentException.class, () -> new Boundaries(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new Boundaries(3, 3));
        assertThrows(IllegalArgumentException.class, () -> new Boundaries(4, 2));
    }

    @Test
    void width_shouldCountBothBoundaries() {
        assertEquals(2, new Boundaries(3, 4).width());
        assertEquals(6, new Boundaries(2, 7).width());
        assertEquals(2, new Boundaries(2, 7).descendantCount());
    }

    @Test
    void containment_shouldDistinguishStrictAndInclusive() {
        Boundaries outer = new Boundaries(1, 8);
        Boundaries inner = new Boundaries(2, 5);

        assertTrue(outer.strictlyContains(inner));
        assertFalse(inner.strictlyContains(outer));
        assertFalse(inner.strictlyContains(inner));
        assertTrue(inner.containsOrEquals(inner));
        assertTrue(outer.covers(5));
        assertFalse(inner.covers(6));
    }

    @Test
    void offset_shouldMoveBothSides() {
        assertEquals(new Boundaries(5, 8), new Boundaries(2, 5).offset(3));
    }

    @Test
    void shift_shouldOnlyTouchValuesAboveThreshold() {
        Shift shift = new Shift(4, 2);
        assertEquals(4, shift.apply(4));
        assertEquals(7, shift.apply(5));
        assertEquals(100, Shift.NONE.apply(100));
        assertTrue(Shift.NONE.isNoop());
    }
}
