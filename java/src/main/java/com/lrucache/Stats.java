package com.lrucache;

/**
 * Occupancy snapshot of the cache, including expired entries not yet reclaimed.
 */
public record Stats(long items, long bytes, long capacityBytes) { }
