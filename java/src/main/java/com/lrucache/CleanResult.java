package com.lrucache;

/**
 * Result metadata from an expiry sweep.
 */
public record CleanResult(long removedItems, long removedBytes, long remainingBytes) { }
