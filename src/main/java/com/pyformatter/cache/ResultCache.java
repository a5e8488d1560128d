package com.pyformatter.cache;

import java.io.IOException;

/**
 * Remembers sources that are already formatted under a given set of options, so a batch run
 * can skip them. Implementations must tolerate concurrent use from the batch worker threads.
 */
public interface ResultCache extends AutoCloseable {

    /**
     * Whether the source behind {@code key} was recorded as formatted.
     */
    boolean isUnchanged(CacheKey key);

    /**
     * Records that the source behind {@code key} needs no further formatting. Recording the
     * same key twice has no additional effect.
     */
    void markFormatted(CacheKey key);

    /**
     * Persists the recorded keys, where the implementation has a backing store.
     */
    void flush() throws IOException;

    @Override
    void close() throws IOException;
}
