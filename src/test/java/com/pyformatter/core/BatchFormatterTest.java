package com.pyformatter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pyformatter.api.CodeFormatter;
import com.pyformatter.api.FormatOptions;
import com.pyformatter.api.FormatterResult;
import com.pyformatter.api.error.ErrorCategory;
import com.pyformatter.cache.CacheKey;
import com.pyformatter.cache.FileResultCache;
import com.pyformatter.cache.InMemoryResultCache;
import com.pyformatter.config.FormatterConfig;

class BatchFormatterTest {

    @TempDir
    Path tempDir;

    @Test
    void formatsEveryUnitAndKeepsOrder() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("a.py", "x=1\n");
        sources.put("b.py", "y = 2\n");
        sources.put("c.py", "def f(:\n");
        sources.put("d.py", "z=[1,\n2]\n");

        BatchFormatter batch = new BatchFormatter(new PythonFormatter(), null, 3);
        Map<String, FormatterResult> results = batch.formatAll(sources, FormatOptions.defaults());

        assertEquals(List.of("a.py", "b.py", "c.py", "d.py"), List.copyOf(results.keySet()));
        assertEquals("x = 1\n", results.get("a.py").getFormattedCode());
        assertEquals(FormatterResult.Outcome.UNCHANGED, results.get("b.py").getOutcome());
        assertEquals(FormatterResult.Outcome.FAILED, results.get("c.py").getOutcome());
        assertEquals(ErrorCategory.SYNTAX, results.get("c.py").getErrors().get(0).getCategory());
        assertEquals("z = [1, 2]\n", results.get("d.py").getFormattedCode());

        assertEquals(4, batch.getProcessedCount());
        assertEquals(2, batch.getChangedCount());
        assertEquals(1, batch.getErrorCount());
    }

    @Test
    void summarizesOnlyFailedUnits() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("good.py", "x = 1\n");
        sources.put("broken.py", "def f(:\n");

        BatchFormatter batch = new BatchFormatter(new PythonFormatter(), null, 2);
        String summary = batch.summarize(batch.formatAll(sources, FormatOptions.defaults()));

        assertTrue(summary.contains("broken.py: 1 fatal"), summary);
        assertFalse(summary.contains("good.py"), summary);
        assertTrue(summary.endsWith("Total: 1 fatal"), summary);
    }

    @Test
    void failingFormatterOnlyAffectsItsUnit() {
        CodeFormatter flaky = (source, options) -> {
            if (source.contains("boom")) {
                throw new IllegalStateException("boom");
            }
            return FormatterResult.builder()
                    .outcome(FormatterResult.Outcome.UNCHANGED)
                    .formattedCode(source)
                    .build();
        };
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("ok", "x = 1\n");
        sources.put("bad", "boom\n");

        Map<String, FormatterResult> results = new BatchFormatter(flaky, null, 2)
                .formatAll(sources, FormatOptions.defaults());

        assertTrue(results.get("ok").isSuccessful());
        assertFalse(results.get("bad").isSuccessful());
        assertEquals("boom\n", results.get("bad").getFormattedCode());
        assertEquals(ErrorCategory.INTERNAL, results.get("bad").getErrors().get(0).getCategory());
    }

    @Test
    void errorThrownByFormatterFailsOnlyItsUnit() {
        CodeFormatter overflowing = (source, options) -> {
            if (source.contains("deep")) {
                throw new StackOverflowError();
            }
            return FormatterResult.builder()
                    .outcome(FormatterResult.Outcome.UNCHANGED)
                    .formattedCode(source)
                    .build();
        };
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("ok", "x = 1\n");
        sources.put("deep", "deep\n");

        BatchFormatter batch = new BatchFormatter(overflowing, null, 2);
        Map<String, FormatterResult> results = batch.formatAll(sources, FormatOptions.defaults());

        assertEquals(List.of("ok", "deep"), List.copyOf(results.keySet()));
        assertEquals(FormatterResult.Outcome.FAILED, results.get("deep").getOutcome());
        assertEquals("deep\n", results.get("deep").getFormattedCode());
        assertEquals(ErrorCategory.INTERNAL, results.get("deep").getErrors().get(0).getCategory());
        assertEquals(1, batch.getErrorCount());
    }

    @Test
    void deeplyNestedSourceIsReportedAsFailed() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("ok", "x=1\n");
        sources.put("deep", "x = " + "(".repeat(300) + "1" + ")".repeat(300) + "\n");

        BatchFormatter batch = new BatchFormatter(new PythonFormatter(), null, 2);
        Map<String, FormatterResult> results = batch.formatAll(sources, FormatOptions.defaults());

        assertEquals(List.of("ok", "deep"), List.copyOf(results.keySet()));
        assertEquals("x = 1\n", results.get("ok").getFormattedCode());
        assertEquals(FormatterResult.Outcome.FAILED, results.get("deep").getOutcome());
        assertEquals(ErrorCategory.SYNTAX, results.get("deep").getErrors().get(0).getCategory());
        assertEquals(1, batch.getErrorCount());
    }

    @Test
    void configuredBatchOpensTheFileCache() throws IOException {
        Path cacheFile = tempDir.resolve("results.json");
        Map<String, Object> general = new HashMap<>();
        general.put("threads", 3);
        Map<String, Object> cacheSection = new HashMap<>();
        cacheSection.put("enabled", true);
        cacheSection.put("file", cacheFile.toString());

        BatchFormatter batch = BatchFormatter.fromConfig(new FormatterConfig(general, cacheSection),
                new PythonFormatter());
        assertEquals(3, batch.getThreadCount());
        assertTrue(batch.getCache() instanceof FileResultCache);
        assertEquals(cacheFile, ((FileResultCache) batch.getCache()).getCacheFile());

        batch.formatAll(Map.of("a.py", "x = 1\n"), FormatOptions.defaults());
        batch.getCache().close();
        assertTrue(FileResultCache.open(cacheFile).isUnchanged(CacheKey.of("x = 1\n", FormatOptions.defaults())));
    }

    @Test
    void disabledCacheIsNotOpened() {
        Map<String, Object> cacheSection = new HashMap<>();
        cacheSection.put("enabled", false);

        BatchFormatter batch = BatchFormatter.fromConfig(new FormatterConfig(new HashMap<>(), cacheSection),
                new PythonFormatter());
        assertNull(batch.getCache());
        assertEquals(Runtime.getRuntime().availableProcessors(), batch.getThreadCount());
    }

    @Test
    void cachedUnitsAreNotFormattedAgain() {
        AtomicInteger calls = new AtomicInteger();
        PythonFormatter real = new PythonFormatter();
        CodeFormatter counting = (source, options) -> {
            calls.incrementAndGet();
            return real.format(source, options);
        };
        InMemoryResultCache cache = new InMemoryResultCache();
        BatchFormatter batch = new BatchFormatter(counting, cache, 1);
        FormatOptions options = FormatOptions.defaults();

        FormatterResult first = batch.formatUnit("a.py", "x=1\n", options);
        assertEquals(FormatterResult.Outcome.REFORMATTED, first.getOutcome());
        assertTrue(cache.isUnchanged(CacheKey.of("x = 1\n", options)));

        FormatterResult second = batch.formatUnit("a.py", "x = 1\n", options);
        assertEquals(FormatterResult.Outcome.UNCHANGED, second.getOutcome());
        assertEquals(1, calls.get());
        assertEquals(1, batch.getCachedCount());
    }

    @Test
    void emptyBatch() {
        BatchFormatter batch = new BatchFormatter(new PythonFormatter(), null, 1);
        assertTrue(batch.formatAll(Map.of(), FormatOptions.defaults()).isEmpty());
    }

    @Test
    void threadCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new BatchFormatter(new PythonFormatter(), null, 0));
    }
}
