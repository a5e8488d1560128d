package com.pyformatter.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.pyformatter.api.FormatOptions;

class CacheKeyTest {

    @Test
    void sameSourceAndOptionsGiveSameKey() {
        assertEquals(CacheKey.of("x = 1\n", FormatOptions.defaults()),
                CacheKey.of("x = 1\n", FormatOptions.defaults()));
    }

    @Test
    void sourceAndOptionsBothMatter() {
        CacheKey key = CacheKey.of("x = 1\n", FormatOptions.defaults());
        assertNotEquals(key, CacheKey.of("x = 2\n", FormatOptions.defaults()));
        assertNotEquals(key, CacheKey.of("x = 1\n", FormatOptions.builder().lineLength(100).build()));
    }

    @Test
    void fastAndDiffDoNotChangeTheKey() {
        assertEquals(CacheKey.of("x = 1\n", FormatOptions.defaults()),
                CacheKey.of("x = 1\n", FormatOptions.builder().fast(true).diff(true).build()));
    }

    @Test
    void hashIsHexSha256() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", CacheKey.sha256(""));
    }

    @Test
    void textFormRoundTrips() {
        CacheKey key = CacheKey.of("x = 1\n", FormatOptions.defaults());
        assertEquals(key, CacheKey.parse(key.toString()));
        assertThrows(IllegalArgumentException.class, () -> CacheKey.parse("no separator"));
    }
}
