package com.lrucache;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key index, recency order and byte accounting for the cache.
 *
 * <p>Entries live in an arena of slots addressed by stable {@code int} handles. The recency
 * order is an intrusive doubly-linked list threaded through the {@code prev}/{@code next}
 * arrays, most recent at {@link #head}. Released slots are chained through {@code next} into
 * a free list and reused by later inserts.
 *
 * <p>Not thread-safe. {@link LruCache} serializes every call under its lock.
 */
final class EntryLedger {

    private static final int NIL = -1;
    private static final int INITIAL_SLOTS = 16;

    private final Map<String, Integer> index = new HashMap<>();
    private final long capacityBytes;

    private CacheEntry[] entries = new CacheEntry[INITIAL_SLOTS];
    private int[] prev = new int[INITIAL_SLOTS];
    private int[] next = new int[INITIAL_SLOTS];
    private int head = NIL;
    private int tail = NIL;
    private int freeHead = NIL;
    private int highWater = 0;
    private long totalBytes = 0;

    EntryLedger(long capacityBytes) {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be positive, got: " + capacityBytes);
        }
        this.capacityBytes = capacityBytes;
    }

    /**
     * Inserts {@code entry} at the front of the recency order, replacing any entry with the same key.
     *
     * @param entry entry to insert
     * @return the replaced entry, if there was one
     */
    Optional<CacheEntry> insertOrReplace(CacheEntry entry) {
        Optional<CacheEntry> replaced = remove(entry.getKey());
        int handle = allocate();
        entries[handle] = entry;
        linkFirst(handle);
        index.put(entry.getKey(), handle);
        totalBytes += entry.size();
        return replaced;
    }

    /**
     * Moves {@code key} to the front of the recency order. No-op if absent.
     *
     * @param key cache key
     */
    void touch(String key) {
        Integer handle = index.get(key);
        if (handle == null || handle == head) {
            return;
        }
        unlink(handle);
        linkFirst(handle);
    }

    /**
     * Removes the least recently used entry.
     *
     * @return the evicted entry, or empty if the ledger holds nothing
     */
    Optional<CacheEntry> evictOldest() {
        if (tail == NIL) {
            return Optional.empty();
        }
        return Optional.of(release(tail));
    }

    /**
     * Returns the entry for {@code key} without changing its recency.
     *
     * @param key cache key
     * @return entry if resident
     */
    Optional<CacheEntry> lookup(String key) {
        Integer handle = index.get(key);
        return handle == null ? Optional.empty() : Optional.of(entries[handle]);
    }

    /**
     * Removes {@code key} if present.
     *
     * @param key cache key
     * @return the removed entry, or empty if the key was not resident
     */
    Optional<CacheEntry> remove(String key) {
        Integer handle = index.get(key);
        if (handle == null) {
            return Optional.empty();
        }
        return Optional.of(release(handle));
    }

    /**
     * Removes every entry that expired before {@code nowMillis}.
     *
     * <p>Handles are collected before anything is removed, so each resident entry is
     * examined exactly once no matter how many neighbours are unlinked during the pass.
     *
     * @param nowMillis current epoch millis
     * @return counts of what was removed and the bytes left behind
     */
    CleanResult sweepExpired(long nowMillis) {
        int[] visit = new int[index.size()];
        int count = 0;
        for (int h = head; h != NIL; h = next[h]) {
            visit[count++] = h;
        }
        long removedItems = 0;
        long removedBytes = 0;
        for (int i = 0; i < count; i++) {
            CacheEntry entry = entries[visit[i]];
            if (entry.isExpired(nowMillis)) {
                release(visit[i]);
                removedItems++;
                removedBytes += entry.size();
            }
        }
        return new CleanResult(removedItems, removedBytes, totalBytes);
    }

    void clear() {
        index.clear();
        Arrays.fill(entries, null);
        head = NIL;
        tail = NIL;
        freeHead = NIL;
        highWater = 0;
        totalBytes = 0;
    }

    int size() {
        return index.size();
    }

    boolean isEmpty() {
        return index.isEmpty();
    }

    long totalBytes() {
        return totalBytes;
    }

    long capacityBytes() {
        return capacityBytes;
    }

    /**
     * Lists resident keys from most to least recently used.
     *
     * @return keys in recency order
     */
    List<String> keysByRecency() {
        List<String> keys = new ArrayList<>(index.size());
        for (int h = head; h != NIL; h = next[h]) {
            keys.add(entries[h].getKey());
        }
        return keys;
    }

    private CacheEntry release(int handle) {
        CacheEntry entry = entries[handle];
        unlink(handle);
        index.remove(entry.getKey());
        totalBytes -= entry.size();
        entries[handle] = null;
        next[handle] = freeHead;
        freeHead = handle;
        return entry;
    }

    private int allocate() {
        if (freeHead != NIL) {
            int handle = freeHead;
            freeHead = next[handle];
            return handle;
        }
        if (highWater == entries.length) {
            int grown = entries.length * 2;
            entries = Arrays.copyOf(entries, grown);
            prev = Arrays.copyOf(prev, grown);
            next = Arrays.copyOf(next, grown);
        }
        return highWater++;
    }

    private void linkFirst(int handle) {
        prev[handle] = NIL;
        next[handle] = head;
        if (head != NIL) {
            prev[head] = handle;
        } else {
            tail = handle;
        }
        head = handle;
    }

    private void unlink(int handle) {
        int p = prev[handle];
        int n = next[handle];
        if (p != NIL) {
            next[p] = n;
        } else {
            head = n;
        }
        if (n != NIL) {
            prev[n] = p;
        } else {
            tail = p;
        }
        prev[handle] = NIL;
        next[handle] = NIL;
    }
}
