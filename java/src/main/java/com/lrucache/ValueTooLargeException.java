package com.lrucache;

/**
 * Thrown when a single value is larger than the whole cache capacity.
 */
public class ValueTooLargeException extends CacheException {

    private final long valueSize;
    private final long capacityBytes;

    /**
     * @param key key the value was offered under
     * @param valueSize length of the rejected value in bytes
     * @param capacityBytes capacity of the cache in bytes
     */
    public ValueTooLargeException(String key, long valueSize, long capacityBytes) {
        super(key, "Value for key '" + key + "' is " + valueSize
                + " bytes, exceeding cache capacity of " + capacityBytes + " bytes");
        this.valueSize = valueSize;
        this.capacityBytes = capacityBytes;
    }

    /**
     * @return length of the rejected value in bytes
     */
    public long getValueSize() {
        return valueSize;
    }

    /**
     * @return capacity of the cache at the time of the rejection
     */
    public long getCapacityBytes() {
        return capacityBytes;
    }
}
