package com.lrucache;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process byte cache bounded by total value size, with least-recently-used eviction
 * and optional per-entry time-to-live.
 *
 * <p>All state is guarded by a single lock per instance. Expired entries are never returned;
 * they are dropped lazily on read and, when a clean interval is configured, proactively by a
 * background reaper.
 */
public final class LruCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LruCache.class);
    private static final Charset UTF8 = StandardCharsets.UTF_8;

    /** Capacity used when none (or a non-positive one) is configured: 64 MiB. */
    public static final long DEFAULT_MAX_SIZE = 64L * 1024 * 1024;

    private final ReentrantLock lock = new ReentrantLock();
    private final EntryLedger ledger;
    private final Duration defaultExpire;
    private final LongSupplier clock;
    private final ExpiryReaper reaper;

    private LruCache(Builder builder) {
        long maxSize = builder.maxSize <= 0 ? DEFAULT_MAX_SIZE : builder.maxSize;
        this.ledger = new EntryLedger(maxSize);
        this.defaultExpire = builder.defaultExpire;
        this.clock = builder.clock;

        Duration interval = builder.cleanInterval;
        if (interval != null && !interval.isZero() && !interval.isNegative()) {
            this.reaper = new ExpiryReaper(interval, this::cleanExpired);
        } else {
            this.reaper = null;
        }
        log.debug("Created cache: maxSize={} bytes, defaultExpire={}, cleanInterval={}",
                maxSize, defaultExpire, reaper == null ? "disabled" : interval);
    }

    /**
     * Creates a builder for configuring an {@link LruCache}.
     *
     * @return builder with default settings
     */
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Opens a cache with the default capacity, no default TTL and no reaper.
     *
     * @return new cache instance
     */
    public static LruCache open() {
        return newBuilder().build();
    }

    /**
     * Opens a cache with {@code maxSize} bytes of capacity and otherwise default settings.
     *
     * @param maxSize capacity in bytes; non-positive selects {@link #DEFAULT_MAX_SIZE}
     * @return new cache instance
     */
    public static LruCache open(long maxSize) {
        return newBuilder().maxSize(maxSize).build();
    }

    /**
     * Stores {@code value} under {@code key} using the configured default expiration.
     *
     * @param key cache key
     * @param value payload bytes, copied before being stored
     * @throws ValueTooLargeException if {@code value} alone exceeds the cache capacity
     */
    public void store(String key, byte[] value) throws ValueTooLargeException {
        store(key, value, null);
    }

    /**
     * Stores {@code value} under {@code key}, evicting least recently used entries until it fits.
     *
     * <p>Expiry is tracked in whole milliseconds: the sub-millisecond part of {@code ttl} is
     * dropped, and an entry stays live through the millisecond in which it expires. A TTL too
     * large to represent as an epoch-millis deadline behaves as no expiry at all.
     *
     * @param key cache key
     * @param value payload bytes, copied before being stored
     * @param ttl time-to-live for this entry, or {@code null} to apply the default expiration
     * @throws ValueTooLargeException if {@code value} alone exceeds the cache capacity; the
     *         cache contents are left unchanged
     * @throws IllegalArgumentException if {@code ttl} is zero or negative
     */
    public void store(String key, byte[] value, Duration ttl) throws ValueTooLargeException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        long capacity = ledger.capacityBytes();
        if (value.length > capacity) {
            log.warn("Rejected value for key '{}': {} bytes exceeds capacity of {} bytes",
                    key, value.length, capacity);
            throw new ValueTooLargeException(key, value.length, capacity);
        }

        lock.lock();
        try {
            long now = clock.getAsLong();
            CacheEntry entry = new CacheEntry(key, value, expiresAt(now, ttl), now);
            // Reclaim the old value first so a replacement never evicts for room it already holds
            ledger.remove(key);
            while (ledger.totalBytes() + value.length > capacity && !ledger.isEmpty()) {
                ledger.evictOldest().ifPresent(evicted ->
                        log.debug("Evicted '{}' ({} bytes) to make room for '{}'",
                                evicted.getKey(), evicted.size(), key));
            }
            ledger.insertOrReplace(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a UTF-8 encoded string value for {@code key}.
     *
     * @param key cache key
     * @param value string payload
     * @throws ValueTooLargeException if the encoded value exceeds the cache capacity
     */
    public void storeString(String key, String value) throws ValueTooLargeException {
        store(key, value.getBytes(UTF8), null);
    }

    /**
     * Stores a UTF-8 encoded string value for {@code key} with an explicit TTL.
     *
     * @param key cache key
     * @param value string payload
     * @param ttl time-to-live, or {@code null} for the default
     * @throws ValueTooLargeException if the encoded value exceeds the cache capacity
     */
    public void storeString(String key, String value, Duration ttl) throws ValueTooLargeException {
        store(key, value.getBytes(UTF8), ttl);
    }

    /**
     * Reads the value for {@code key} and marks it most recently used.
     *
     * @param key cache key
     * @return stream over a copy of the stored bytes
     * @throws EntryNotFoundException if the key is absent or its entry has expired
     */
    public InputStream get(String key) throws EntryNotFoundException {
        return getEntry(key)
                .map(entry -> (InputStream) new ByteArrayInputStream(entry.getValue()))
                .orElseThrow(() -> new EntryNotFoundException(key));
    }

    /**
     * Reads the value for {@code key} as raw bytes and marks it most recently used.
     *
     * @param key cache key
     * @return copy of the payload if present and not expired
     */
    public Optional<byte[]> getIfPresent(String key) {
        return getEntry(key).map(CacheEntry::getValue);
    }

    /**
     * Reads the value for {@code key} decoded as UTF-8.
     *
     * @param key cache key
     * @return optional decoded string
     */
    public Optional<String> getString(String key) {
        return getEntry(key).map(CacheEntry::getValueAsString);
    }

    /**
     * Returns a snapshot of the entry for {@code key}, including its expiry metadata.
     * Counts as an access for recency.
     *
     * @param key cache key
     * @return optional entry snapshot
     */
    public Optional<CacheEntry> getEntry(String key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            Optional<CacheEntry> found = ledger.lookup(key);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            if (found.get().isExpired(clock.getAsLong())) {
                ledger.remove(key);
                log.debug("Dropped expired entry '{}' on read", key);
                return Optional.empty();
            }
            ledger.touch(key);
            return found;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks whether {@code key} holds a live entry, without affecting its recency.
     *
     * @param key cache key
     * @return {@code true} if the key is resident and not expired
     */
    public boolean contains(String key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            long now = clock.getAsLong();
            return ledger.lookup(key).map(entry -> !entry.isExpired(now)).orElse(false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes {@code key} if present.
     *
     * @param key cache key
     * @return {@code true} if a live entry was removed
     */
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            long now = clock.getAsLong();
            return ledger.remove(key).map(entry -> !entry.isExpired(now)).orElse(false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lists live keys from most to least recently used. Does not affect recency.
     *
     * @return snapshot of live keys
     */
    public List<String> keys() {
        lock.lock();
        try {
            long now = clock.getAsLong();
            return ledger.keysByRecency().stream()
                    .filter(key -> ledger.lookup(key).map(entry -> !entry.isExpired(now)).orElse(false))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports the resident entry count and byte total. Expired entries awaiting a sweep
     * are still counted, since they still hold memory.
     *
     * @return current occupancy
     */
    public Stats stats() {
        lock.lock();
        try {
            return new Stats(ledger.size(), ledger.totalBytes(), ledger.capacityBytes());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired entry now. This is what the background reaper runs on each tick.
     *
     * @return result describing the sweep
     */
    public CleanResult cleanExpired() {
        lock.lock();
        try {
            return ledger.sweepExpired(clock.getAsLong());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every entry.
     */
    public void clear() {
        lock.lock();
        try {
            ledger.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports whether the background reaper is scheduled.
     *
     * @return {@code true} while the reaper is active
     */
    public boolean isReaperRunning() {
        return reaper != null && reaper.isRunning();
    }

    /**
     * Stops the background reaper, if any. The cache itself stays usable; expired entries are
     * then only reclaimed on read or through {@link #cleanExpired()}.
     */
    @Override
    public void close() {
        if (reaper != null) {
            reaper.close();
        }
    }

    private long expiresAt(long now, Duration ttl) {
        if (ttl != null) {
            return deadline(now, ttl);
        }
        if (defaultExpire != null && !defaultExpire.isZero()) {
            return deadline(now, defaultExpire);
        }
        return CacheEntry.NEVER_EXPIRES;
    }

    private static long deadline(long now, Duration ttl) {
        try {
            return Math.addExact(now, ttl.toMillis());
        } catch (ArithmeticException e) {
            // saturate: a deadline past the end of epoch millis is never reached
            return Long.MAX_VALUE;
        }
    }

    /**
     * Builder for configuring {@link LruCache} instances.
     */
    public static final class Builder {
        private long maxSize = DEFAULT_MAX_SIZE;
        private Duration defaultExpire = null;
        private Duration cleanInterval = null;
        private LongSupplier clock = System::currentTimeMillis;

        private Builder() {
        }

        /**
         * Sets the cache capacity in bytes.
         *
         * @param maxSize total value bytes the cache may hold; non-positive selects {@link #DEFAULT_MAX_SIZE}
         * @return this builder
         */
        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        /**
         * Sets the TTL applied to entries stored without one.
         *
         * @param defaultExpire default TTL, or {@code null}/zero for entries that never expire
         * @return this builder
         * @throws IllegalArgumentException if {@code defaultExpire} is negative
         */
        public Builder defaultExpire(Duration defaultExpire) {
            if (defaultExpire != null && defaultExpire.isNegative()) {
                throw new IllegalArgumentException("defaultExpire must not be negative, got: " + defaultExpire);
            }
            this.defaultExpire = defaultExpire;
            return this;
        }

        /**
         * Enables the background reaper at the given interval.
         *
         * @param cleanInterval sweep period; {@code null}, zero or negative disables the reaper
         * @return this builder
         */
        public Builder cleanInterval(Duration cleanInterval) {
            this.cleanInterval = cleanInterval;
            return this;
        }

        /**
         * Replaces the time source used for expiry decisions.
         *
         * @param nowMillis supplier of the current epoch millis
         * @return this builder
         */
        public Builder clock(LongSupplier nowMillis) {
            this.clock = Objects.requireNonNull(nowMillis, "nowMillis");
            return this;
        }

        /**
         * Builds an {@link LruCache} with the configured options.
         *
         * @return new cache instance
         */
        public LruCache build() {
            return new LruCache(this);
        }
    }
}
