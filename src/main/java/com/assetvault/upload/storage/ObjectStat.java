package com.assetvault.upload.storage;

/**
 * What the object store reports for a key. {@code sizeBytes} and {@code contentType}
 * are meaningful only when {@code exists} is true.
 */
public record ObjectStat(boolean exists, long sizeBytes, String contentType) {

    public static ObjectStat missing() {
        return new ObjectStat(false, 0L, null);
    }

    public static ObjectStat of(long sizeBytes, String contentType) {
        return new ObjectStat(true, sizeBytes, contentType);
    }
}
