package com.lrucache;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically sweeps expired entries out of a cache, independent of access pattern.
 *
 * <p>Each tick runs the supplied sweep, which acquires the cache lock itself. The next tick
 * is scheduled one interval after the previous one finishes.
 */
final class ExpiryReaper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExpiryReaper.class);

    static final String THREAD_NAME = "LruCache-Reaper";
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ScheduledExecutorService scheduler;
    private final Supplier<CleanResult> sweep;
    private final Duration interval;
    private volatile boolean closed = false;

    ExpiryReaper(Duration interval, Supplier<CleanResult> sweep) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
        this.interval = interval;
        this.sweep = Objects.requireNonNull(sweep, "sweep");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
        long intervalNanos = interval.toNanos();
        this.scheduler.scheduleWithFixedDelay(this::tick, intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
        log.info("Expiry reaper started with interval {}", interval);
    }

    boolean isRunning() {
        return !closed && !scheduler.isShutdown();
    }

    Duration interval() {
        return interval;
    }

    private void tick() {
        if (closed) {
            return;
        }
        try {
            CleanResult result = sweep.get();
            if (result.removedItems() > 0) {
                log.debug("Reaped {} expired entries ({} bytes), {} bytes remain",
                        result.removedItems(), result.removedBytes(), result.remainingBytes());
            }
        } catch (RuntimeException e) {
            // An exception escaping here would cancel every later tick
            log.warn("Expiry sweep failed, retrying in {}", interval, e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Expiry reaper did not stop within {}s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Expiry reaper stopped");
    }
}
