package com.questrail.hil.transport;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TimestampedLineTest {

    @Test
    void comparesEqualToLineWithSameText() {
        TimestampedLine early = new TimestampedLine("OK", 10);
        TimestampedLine late = new TimestampedLine("OK", 20);

        assertEquals(early, late);
        assertEquals(early.hashCode(), late.hashCode());
        assertNotEquals(early, new TimestampedLine("ERR", 10));
        assertEquals("OK", late.toString());
    }

    @Test
    void isAfterIsStrict() {
        TimestampedLine line = new TimestampedLine("OK", 100);

        assertTrue(line.isAfter(99));
        assertFalse(line.isAfter(100));
        assertFalse(line.isAfter(101));
    }

    @Test
    void timestampInSeconds() {
        assertEquals(1.5, new TimestampedLine("", 1_500_000_000L).timestampSeconds(), 1e-9);
    }

    @Test
    void blankLines() {
        assertTrue(new TimestampedLine("", 0).isBlank());
        assertTrue(new TimestampedLine(" \t", 0).isBlank());
        assertFalse(new TimestampedLine(" x ", 0).isBlank());
    }
}
