package org.img2book.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormatsTest {

    @Test
    void testFormatBytes() {
        assertEquals("0", Formats.formatBytes(0));
        assertEquals("999", Formats.formatBytes(999));
        assertEquals("1,234,567", Formats.formatBytes(1_234_567));
    }

    @Test
    void testFormatDuration() {
        assertEquals("0ms", Formats.formatDuration(0));
        assertEquals("0ms", Formats.formatDuration(-5));
        assertEquals("123ms", Formats.formatDuration(123));
        assertEquals("45s 123ms", Formats.formatDuration(45_123));
        assertEquals("1h 23m 45s 123ms", Formats.formatDuration(5_025_123));
        assertEquals("2m", Formats.formatDuration(120_000));
    }
}
