package com.lrucache;

/**
 * Thrown when a key is absent or its entry has expired at read time.
 */
public class EntryNotFoundException extends CacheException {

    /**
     * @param key key that had no live entry
     */
    public EntryNotFoundException(String key) {
        super(key, "Entry not found: " + key);
    }
}
