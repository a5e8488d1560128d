package com.pyformatter.core;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.pyformatter.api.CodeFormatter;
import com.pyformatter.api.FormatOptions;
import com.pyformatter.api.FormatterResult;
import com.pyformatter.api.error.ErrorCategory;
import com.pyformatter.api.error.FormatterError;
import com.pyformatter.api.error.Severity;
import com.pyformatter.cache.CacheKey;
import com.pyformatter.cache.FileResultCache;
import com.pyformatter.cache.ResultCache;
import com.pyformatter.config.FormatterConfig;
import com.pyformatter.util.ErrorFormatter;
import com.pyformatter.util.LoggerUtil;

/**
 * Formats many independent sources in parallel on a fixed thread pool.
 * A failing unit only affects its own result.
 */
public class BatchFormatter {
    private static final Logger logger = LoggerUtil.getLogger(BatchFormatter.class);
    private static final String DEFAULT_CACHE_FILE = ".pyformatter-cache.json";

    private final CodeFormatter formatter;
    private final ResultCache cache;
    private final int threadCount;
    private final ErrorFormatter errorFormatter = new ErrorFormatter(false);

    private final AtomicInteger processedCount = new AtomicInteger(0);
    private final AtomicInteger cachedCount = new AtomicInteger(0);
    private final AtomicInteger changedCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    /**
     * Creates a batch formatter.
     *
     * @param formatter   the formatter applied to every unit
     * @param cache       cache consulted before and updated after each unit, may be null
     * @param threadCount number of worker threads
     */
    public BatchFormatter(CodeFormatter formatter, ResultCache cache, int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Thread count must be positive: " + threadCount);
        }
        this.formatter = formatter;
        this.cache = cache;
        this.threadCount = threadCount;
    }

    public BatchFormatter(CodeFormatter formatter, ResultCache cache) {
        this(formatter, cache, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Creates a batch formatter from the {@code threads} setting of the general section and the
     * cache section of {@code config}. When the cache is enabled, the file it names is opened;
     * the caller closes it through {@link #getCache()} at the end of the run.
     */
    public static BatchFormatter fromConfig(FormatterConfig config, CodeFormatter formatter) {
        int threads = config.getGeneralConfig("threads", Runtime.getRuntime().availableProcessors());
        ResultCache cache = null;
        if (config.getCacheConfig("enabled", true)) {
            Path cacheFile = Paths.get(config.getCacheConfig("file", DEFAULT_CACHE_FILE));
            logger.info("Using result cache " + cacheFile.toAbsolutePath());
            cache = FileResultCache.open(cacheFile);
        }
        return new BatchFormatter(formatter, cache, threads);
    }

    /**
     * Formats every source, keyed by a caller-chosen unit name. The returned map keeps the
     * iteration order of {@code sources}.
     */
    public Map<String, FormatterResult> formatAll(Map<String, String> sources, FormatOptions options) {
        Map<String, FormatterResult> results = new LinkedHashMap<>();
        if (sources.isEmpty()) {
            return results;
        }
        logger.info("Formatting " + sources.size() + " units on " + threadCount + " threads");

        Map<String, Future<FormatterResult>> futures = new LinkedHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        try {
            for (Map.Entry<String, String> entry : sources.entrySet()) {
                futures.put(entry.getKey(),
                        executor.submit(() -> formatUnit(entry.getKey(), entry.getValue(), options)));
            }
            executor.shutdown();
            if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for formatting to complete");
                executor.shutdownNow();
            }
            for (Map.Entry<String, Future<FormatterResult>> entry : futures.entrySet()) {
                String unit = entry.getKey();
                results.put(unit, collect(unit, sources.get(unit), entry.getValue()));
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Batch formatting interrupted", e);
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        logger.info("Processed " + results.size() + " units: changed=" + changedCount.get()
                + ", cached=" + cachedCount.get() + ", errors=" + errorCount.get());
        if (errorCount.get() > 0) {
            logger.warning(summarize(results));
        }
        return results;
    }

    private FormatterResult collect(String unit, String source, Future<FormatterResult> future)
            throws InterruptedException {
        try {
            if (future.isDone()) {
                return future.get();
            }
            future.cancel(true);
            return failedUnit(source, "Formatting did not complete in time");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.log(Level.SEVERE, "Unexpected error formatting unit: " + unit, cause);
            return failedUnit(source, "Unexpected error: " + cause);
        } catch (CancellationException e) {
            return failedUnit(source, "Formatting was cancelled");
        }
    }

    private FormatterResult failedUnit(String source, String message) {
        errorCount.incrementAndGet();
        return FormatterResult.builder()
                .outcome(FormatterResult.Outcome.FAILED)
                .formattedCode(source)
                .addError(new FormatterError(Severity.FATAL, ErrorCategory.INTERNAL, message, 0, 0))
                .build();
    }

    /**
     * Formats one unit, consulting and updating the cache.
     */
    public FormatterResult formatUnit(String unit, String source, FormatOptions options) {
        processedCount.incrementAndGet();
        try {
            CacheKey key = cache != null ? CacheKey.of(source, options) : null;
            if (key != null && cache.isUnchanged(key)) {
                cachedCount.incrementAndGet();
                logger.fine("Cached as formatted: " + unit);
                return FormatterResult.builder()
                        .outcome(FormatterResult.Outcome.UNCHANGED)
                        .formattedCode(source)
                        .build();
            }

            FormatterResult result = formatter.format(source, options);
            if (!result.isSuccessful()) {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + unit + "\n" + result.getErrors().stream()
                        .map(errorFormatter::formatDetailed)
                        .collect(Collectors.joining("\n")));
                return result;
            }
            if (result.isChanged()) {
                changedCount.incrementAndGet();
                logger.fine("Reformatted: " + unit);
            }
            if (cache != null) {
                if (result.getOutcome() == FormatterResult.Outcome.UNCHANGED) {
                    cache.markFormatted(key);
                } else if (result.getOutcome() == FormatterResult.Outcome.REFORMATTED) {
                    cache.markFormatted(CacheKey.of(result.getFormattedCode(), options));
                }
            }
            return result;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error formatting unit: " + unit, e);
            return failedUnit(source, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Summarizes the errors of the failed units in {@code results}.
     */
    public String summarize(Map<String, FormatterResult> results) {
        Map<String, List<FormatterError>> unitErrors = new LinkedHashMap<>();
        results.forEach((unit, result) -> {
            if (!result.isSuccessful()) {
                unitErrors.put(unit, result.getErrors());
            }
        });
        return errorFormatter.formatErrorSummary(unitErrors);
    }

    /**
     * The cache consulted by this formatter, or null when it runs without one.
     */
    public ResultCache getCache() {
        return cache;
    }

    public int getThreadCount() {
        return threadCount;
    }

    public int getProcessedCount() {
        return processedCount.get();
    }

    public int getCachedCount() {
        return cachedCount.get();
    }

    public int getChangedCount() {
        return changedCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }
}
