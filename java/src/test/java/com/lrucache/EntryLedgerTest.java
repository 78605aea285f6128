package com.lrucache;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EntryLedgerTest {

    private EntryLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new EntryLedger(1_000);
    }

    private static CacheEntry entry(String key, int size, long expiresAt) {
        return new CacheEntry(key, new byte[size], expiresAt, 0L);
    }

    private static CacheEntry entry(String key, int size) {
        return entry(key, size, CacheEntry.NEVER_EXPIRES);
    }

    @Test
    void insertPlacesNewestFirst() {
        ledger.insertOrReplace(entry("a", 1));
        ledger.insertOrReplace(entry("b", 2));
        ledger.insertOrReplace(entry("c", 3));

        assertEquals(List.of("c", "b", "a"), ledger.keysByRecency());
        assertEquals(3, ledger.size());
        assertEquals(6, ledger.totalBytes());
    }

    @Test
    void replaceAdjustsBytesAndMovesToFront() {
        ledger.insertOrReplace(entry("a", 10));
        ledger.insertOrReplace(entry("b", 20));

        ledger.insertOrReplace(entry("a", 5));

        assertEquals(List.of("a", "b"), ledger.keysByRecency());
        assertEquals(2, ledger.size());
        assertEquals(25, ledger.totalBytes());
        assertEquals(5, ledger.lookup("a").orElseThrow().size());
    }

    @Test
    void touchMovesEntryToFront() {
        ledger.insertOrReplace(entry("a", 1));
        ledger.insertOrReplace(entry("b", 1));
        ledger.insertOrReplace(entry("c", 1));

        ledger.touch("a");
        assertEquals(List.of("a", "c", "b"), ledger.keysByRecency());

        ledger.touch("b");
        assertEquals(List.of("b", "a", "c"), ledger.keysByRecency());

        ledger.touch("missing");
        assertEquals(List.of("b", "a", "c"), ledger.keysByRecency());
    }

    @Test
    void lookupDoesNotChangeOrder() {
        ledger.insertOrReplace(entry("a", 1));
        ledger.insertOrReplace(entry("b", 1));

        assertTrue(ledger.lookup("a").isPresent());
        assertTrue(ledger.lookup("missing").isEmpty());
        assertEquals(List.of("b", "a"), ledger.keysByRecency());
    }

    @Test
    void evictOldestRemovesFromBack() {
        ledger.insertOrReplace(entry("a", 4));
        ledger.insertOrReplace(entry("b", 6));

        CacheEntry evicted = ledger.evictOldest().orElseThrow();
        assertEquals("a", evicted.getKey());
        assertEquals(6, ledger.totalBytes());
        assertTrue(ledger.lookup("a").isEmpty());

        assertEquals("b", ledger.evictOldest().orElseThrow().getKey());
        assertTrue(ledger.evictOldest().isEmpty());
        assertTrue(ledger.isEmpty());
        assertEquals(0, ledger.totalBytes());
    }

    @Test
    void removeIsIdempotent() {
        ledger.insertOrReplace(entry("a", 3));

        assertTrue(ledger.remove("a").isPresent());
        assertTrue(ledger.remove("a").isEmpty());
        assertEquals(0, ledger.size());
        assertEquals(0, ledger.totalBytes());
        assertEquals(List.of(), ledger.keysByRecency());
    }

    @Test
    void sweepRemovesAdjacentExpiredEntriesWithoutSkipping() {
        // head, middle run and tail all expired
        ledger.insertOrReplace(entry("e1", 1, 50));
        ledger.insertOrReplace(entry("e2", 2, 50));
        ledger.insertOrReplace(entry("live1", 4));
        ledger.insertOrReplace(entry("e3", 8, 50));
        ledger.insertOrReplace(entry("e4", 16, 50));
        ledger.insertOrReplace(entry("live2", 32, 500));
        ledger.insertOrReplace(entry("e5", 64, 50));

        CleanResult result = ledger.sweepExpired(100);

        assertEquals(5, result.removedItems());
        assertEquals(1 + 2 + 8 + 16 + 64, result.removedBytes());
        assertEquals(36, result.remainingBytes());
        assertEquals(List.of("live2", "live1"), ledger.keysByRecency());
        assertEquals(36, ledger.totalBytes());
    }

    @Test
    void sweepCanEmptyTheLedger() {
        for (int i = 0; i < 40; i++) {
            ledger.insertOrReplace(entry("k" + i, 1, 10));
        }

        CleanResult result = ledger.sweepExpired(11);

        assertEquals(40, result.removedItems());
        assertTrue(ledger.isEmpty());
        assertEquals(0, ledger.totalBytes());
    }

    @Test
    void sweepKeepsEntriesExpiringExactlyNowAndNeverExpiring() {
        ledger.insertOrReplace(entry("boundary", 1, 100));
        ledger.insertOrReplace(entry("forever", 1));

        CleanResult result = ledger.sweepExpired(100);

        assertEquals(0, result.removedItems());
        assertEquals(2, ledger.size());
    }

    @Test
    void releasedSlotsAreReusedConsistently() {
        for (int i = 0; i < 100; i++) {
            ledger.insertOrReplace(entry("k" + i, 5));
        }
        for (int i = 0; i < 100; i += 2) {
            ledger.remove("k" + i);
        }
        for (int i = 100; i < 150; i++) {
            ledger.insertOrReplace(entry("k" + i, 5));
        }

        List<String> keys = ledger.keysByRecency();
        assertEquals(100, ledger.size());
        assertEquals(100, keys.size());
        assertEquals(100, keys.stream().distinct().count());
        assertEquals(500, ledger.totalBytes());
        assertEquals("k149", keys.get(0));
        assertEquals("k1", keys.get(keys.size() - 1));
        for (String key : keys) {
            assertTrue(ledger.lookup(key).isPresent());
        }
    }

    @Test
    void clearResetsEverything() {
        ledger.insertOrReplace(entry("a", 10));
        ledger.insertOrReplace(entry("b", 10));

        ledger.clear();

        assertTrue(ledger.isEmpty());
        assertEquals(0, ledger.totalBytes());
        assertEquals(List.of(), ledger.keysByRecency());

        ledger.insertOrReplace(entry("c", 3));
        assertEquals(List.of("c"), ledger.keysByRecency());
        assertEquals(3, ledger.totalBytes());
    }

    @Test
    void storedEntryIsNotAliasedByCallerBuffer() {
        byte[] buffer = "abc".getBytes(StandardCharsets.UTF_8);
        ledger.insertOrReplace(new CacheEntry("k", buffer, CacheEntry.NEVER_EXPIRES, 0L));
        buffer[0] = 'z';

        assertEquals("abc", ledger.lookup("k").orElseThrow().getValueAsString());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new EntryLedger(0));
    }
}
