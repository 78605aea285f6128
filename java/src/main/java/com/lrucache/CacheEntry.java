package com.lrucache;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Immutable cache entry. The value is copied on construction and on every read,
 * so an entry never exposes the bytes held by the cache.
 */
public final class CacheEntry {

    /** Marker for entries that never expire. */
    public static final long NEVER_EXPIRES = 0L;

    private final String key;
    private final byte[] value;
    private final long expiresAtMillis;
    private final long createdAtMillis;

    CacheEntry(String key, byte[] value, long expiresAtMillis, long createdAtMillis) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value").clone();
        this.expiresAtMillis = expiresAtMillis;
        this.createdAtMillis = createdAtMillis;
    }

    /**
     * Returns the logical cache key for this entry.
     *
     * @return cache key string
     */
    public String getKey() {
        return key;
    }

    /**
     * Returns a defensive copy of the stored value bytes.
     *
     * @return value payload
     */
    public byte[] getValue() {
        return value.clone();
    }

    /**
     * Decodes the value as UTF-8 text.
     *
     * @return value as string
     */
    public String getValueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    /**
     * Returns the number of bytes this entry accounts for against the cache capacity.
     *
     * @return value length in bytes
     */
    public int size() {
        return value.length;
    }

    /**
     * Returns the absolute expiration timestamp in milliseconds.
     *
     * @return epoch millis when the entry expires, or {@link #NEVER_EXPIRES}
     */
    public long getExpiresAtMillis() {
        return expiresAtMillis;
    }

    /**
     * Returns when the entry was stored.
     *
     * @return creation time in epoch milliseconds
     */
    public long getCreatedAtMillis() {
        return createdAtMillis;
    }

    /**
     * Checks whether the entry carries an expiration time.
     *
     * @return {@code true} unless the entry never expires
     */
    public boolean hasExpiry() {
        return expiresAtMillis != NEVER_EXPIRES;
    }

    /**
     * Checks whether the entry is logically absent at {@code nowMillis}.
     *
     * @param nowMillis current epoch millis
     * @return {@code true} if the entry has an expiry strictly before {@code nowMillis}
     */
    public boolean isExpired(long nowMillis) {
        return hasExpiry() && expiresAtMillis < nowMillis;
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key + ", size=" + value.length + ", expiresAtMillis=" + expiresAtMillis + '}';
    }
}
