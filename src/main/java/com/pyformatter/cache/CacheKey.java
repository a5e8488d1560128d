package com.pyformatter.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

import com.pyformatter.api.FormatOptions;

/**
 * Identifies one source text formatted under one set of options: the SHA-256 of the source
 * followed by the options fingerprint.
 */
public final class CacheKey {
    private final String sourceHash;
    private final String optionsFingerprint;

    private CacheKey(String sourceHash, String optionsFingerprint) {
        this.sourceHash = sourceHash;
        this.optionsFingerprint = optionsFingerprint;
    }

    public static CacheKey of(String source, FormatOptions options) {
        return new CacheKey(sha256(source), options.fingerprint());
    }

    /**
     * Rebuilds a key from the text produced by {@link #toString()}.
     */
    public static CacheKey parse(String text) {
        int separator = text.indexOf('|');
        if (separator < 0) {
            throw new IllegalArgumentException("Malformed cache key: " + text);
        }
        return new CacheKey(text.substring(0, separator), text.substring(separator + 1));
    }

    public String getSourceHash() {
        return sourceHash;
    }

    public String getOptionsFingerprint() {
        return optionsFingerprint;
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheKey)) {
            return false;
        }
        CacheKey other = (CacheKey) o;
        return sourceHash.equals(other.sourceHash) && optionsFingerprint.equals(other.optionsFingerprint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceHash, optionsFingerprint);
    }

    @Override
    public String toString() {
        return sourceHash + "|" + optionsFingerprint;
    }
}
