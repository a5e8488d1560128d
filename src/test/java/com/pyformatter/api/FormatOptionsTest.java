package com.pyformatter.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FormatOptionsTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        FormatOptions options = FormatOptions.defaults();
        assertEquals(88, options.getLineLength());
        assertTrue(options.getTargetVersions().isEmpty());
        assertTrue(options.isMagicTrailingComma());
        assertFalse(options.isPyi());
        assertFalse(options.isFast());
        assertFalse(options.isDiff());
    }

    @Test
    void equalOptionsShareFingerprintAndHash() {
        FormatOptions first = FormatOptions.builder().lineLength(100).addTargetVersion(TargetVersion.PY311).build();
        FormatOptions second = FormatOptions.builder().lineLength(100).addTargetVersion(TargetVersion.PY311).build();
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals(first.fingerprint(), second.fingerprint());

        assertNotEquals(first, FormatOptions.builder().lineLength(100).build());
        assertNotEquals(first, "ll=100");
    }

    @Test
    void lineRangesCompareByBounds() {
        assertEquals(new LineRange(2, 5), LineRange.parse(" 2-5 "));
        assertNotEquals(new LineRange(2, 5), new LineRange(2, 6));
        assertTrue(new LineRange(2, 5).intersects(5, 9));
        assertFalse(new LineRange(2, 5).intersects(6, 9));
        assertThrows(IllegalArgumentException.class, () -> new LineRange(3, 2));
        assertThrows(IllegalArgumentException.class, () -> LineRange.parse("7"));
    }
}
