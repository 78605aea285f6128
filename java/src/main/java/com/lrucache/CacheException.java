package com.lrucache;

/**
 * Base type for the failures reported by {@link LruCache}.
 */
public class CacheException extends Exception {

    private final String key;

    protected CacheException(String key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * Returns the key the failed operation was called with.
     *
     * @return cache key
     */
    public String getKey() {
        return key;
    }
}
