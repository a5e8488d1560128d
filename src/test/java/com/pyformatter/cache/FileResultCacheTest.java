package com.pyformatter.cache;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pyformatter.api.FormatOptions;

class FileResultCacheTest {

    @TempDir
    Path tempDir;

    @Test
    void recordedKeysSurviveReopening() throws IOException {
        Path file = tempDir.resolve("cache.json");
        CacheKey key = CacheKey.of("x = 1\n", FormatOptions.defaults());

        try (FileResultCache cache = FileResultCache.open(file)) {
            assertFalse(cache.isUnchanged(key));
            cache.markFormatted(key);
            assertTrue(cache.isUnchanged(key));
        }
        assertTrue(Files.exists(file));

        try (FileResultCache reopened = FileResultCache.open(file)) {
            assertTrue(reopened.isUnchanged(key));
            assertFalse(reopened.isUnchanged(CacheKey.of("x = 1\n", FormatOptions.builder().pyi(true).build())));
        }
    }

    @Test
    void missingDirectoriesAreCreatedOnFlush() throws IOException {
        Path file = tempDir.resolve("nested/dir/cache.json");
        FileResultCache cache = FileResultCache.open(file);
        cache.markFormatted(CacheKey.of("y = 2\n", FormatOptions.defaults()));
        cache.flush();
        assertTrue(Files.exists(file));
    }

    @Test
    void corruptFileGivesEmptyCache() throws IOException {
        Path file = tempDir.resolve("cache.json");
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);
        FileResultCache cache = FileResultCache.open(file);
        assertFalse(cache.isUnchanged(CacheKey.of("x = 1\n", FormatOptions.defaults())));
    }

    @Test
    void nothingIsWrittenWithoutChanges() throws IOException {
        Path file = tempDir.resolve("cache.json");
        FileResultCache.open(file).close();
        assertFalse(Files.exists(file));
    }

    @Test
    void keysMarkedAfterAFlushAreWrittenByTheNext() throws IOException {
        Path file = tempDir.resolve("cache.json");
        CacheKey first = CacheKey.of("x = 1\n", FormatOptions.defaults());
        CacheKey second = CacheKey.of("y = 2\n", FormatOptions.defaults());

        FileResultCache cache = FileResultCache.open(file);
        cache.markFormatted(first);
        cache.flush();
        cache.markFormatted(second);
        cache.flush();

        FileResultCache reopened = FileResultCache.open(file);
        assertTrue(reopened.isUnchanged(first));
        assertTrue(reopened.isUnchanged(second));
    }

    @Test
    void failedFlushIsRetried() throws IOException {
        Path file = tempDir.resolve("cache.json");
        Path blocker = Files.createDirectories(file.resolve("blocker"));
        CacheKey key = CacheKey.of("x = 1\n", FormatOptions.defaults());

        FileResultCache cache = FileResultCache.open(file);
        cache.markFormatted(key);
        assertThrows(IOException.class, cache::flush);

        Files.delete(blocker);
        Files.delete(file);
        cache.flush();

        assertTrue(Files.isRegularFile(file));
        assertTrue(FileResultCache.open(file).isUnchanged(key));
    }

    @Test
    void inMemoryCacheIsIdempotent() {
        InMemoryResultCache cache = new InMemoryResultCache();
        CacheKey key = CacheKey.of("x = 1\n", FormatOptions.defaults());
        cache.markFormatted(key);
        cache.markFormatted(key);
        assertTrue(cache.isUnchanged(key));
        assertTrue(cache.size() == 1);
    }
}
