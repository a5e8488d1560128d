package com.pyformatter.cache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pyformatter.util.LoggerUtil;

/**
 * Cache persisted as a JSON document that maps each options fingerprint to the hashes of the
 * sources already formatted under it. The file is read once when the cache is opened and
 * rewritten as a whole on {@link #flush()}.
 */
public class FileResultCache implements ResultCache {
    private static final Logger logger = LoggerUtil.getLogger(FileResultCache.class);

    private final Path cacheFile;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Map<String, Map<String, Boolean>> entries = new ConcurrentHashMap<>();
    private volatile boolean dirty;

    private FileResultCache(Path cacheFile) {
        this.cacheFile = cacheFile;
    }

    /**
     * Opens the cache stored at {@code cacheFile}. A missing file gives an empty cache, and so
     * does an unreadable one, after a warning.
     */
    public static FileResultCache open(Path cacheFile) {
        FileResultCache cache = new FileResultCache(cacheFile);
        if (Files.exists(cacheFile)) {
            try {
                Map<String, List<String>> stored = cache.mapper.readValue(cacheFile.toFile(),
                        new TypeReference<Map<String, List<String>>>() { });
                for (Map.Entry<String, List<String>> entry : stored.entrySet()) {
                    Map<String, Boolean> hashes = cache.entries.computeIfAbsent(entry.getKey(),
                            k -> new ConcurrentHashMap<>());
                    for (String hash : entry.getValue()) {
                        hashes.put(hash, Boolean.TRUE);
                    }
                }
                logger.fine("Loaded result cache from " + cacheFile);
            } catch (IOException e) {
                logger.log(Level.WARNING, "Ignoring unreadable result cache: " + cacheFile, e);
                cache.entries.clear();
            }
        }
        return cache;
    }

    @Override
    public boolean isUnchanged(CacheKey key) {
        Map<String, Boolean> hashes = entries.get(key.getOptionsFingerprint());
        return hashes != null && hashes.containsKey(key.getSourceHash());
    }

    @Override
    public void markFormatted(CacheKey key) {
        Boolean previous = entries.computeIfAbsent(key.getOptionsFingerprint(), k -> new ConcurrentHashMap<>())
                .put(key.getSourceHash(), Boolean.TRUE);
        if (previous == null) {
            dirty = true;
        }
    }

    @Override
    public synchronized void flush() throws IOException {
        if (!dirty) {
            return;
        }
        // cleared first: a mark landing during the write sets it again
        dirty = false;
        Map<String, List<String>> snapshot = new TreeMap<>();
        for (Map.Entry<String, Map<String, Boolean>> entry : entries.entrySet()) {
            List<String> hashes = new ArrayList<>(entry.getValue().keySet());
            Collections.sort(hashes);
            snapshot.put(entry.getKey(), hashes);
        }
        Path parent = cacheFile.toAbsolutePath().getParent();
        Path temp = null;
        try {
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, "cache", ".tmp");
            mapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, cacheFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            dirty = true;
            throw e;
        } finally {
            if (temp != null) {
                Files.deleteIfExists(temp);
            }
        }
        logger.fine("Wrote result cache to " + cacheFile);
    }

    @Override
    public void close() throws IOException {
        flush();
    }

    public Path getCacheFile() {
        return cacheFile;
    }
}
