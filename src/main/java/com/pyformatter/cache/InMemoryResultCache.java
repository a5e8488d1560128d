package com.pyformatter.cache;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache that lives as long as the process. Flushing and closing do nothing.
 */
public class InMemoryResultCache implements ResultCache {
    private final Set<CacheKey> formatted = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isUnchanged(CacheKey key) {
        return formatted.contains(key);
    }

    @Override
    public void markFormatted(CacheKey key) {
        formatted.add(key);
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }

    public int size() {
        return formatted.size();
    }
}
