package io.invoiceops.core;

import java.time.Instant;

/**
 * One object listed from a bucket.
 *
 * @param key        full key within the bucket
 * @param name       basename of the key
 * @param size       size in bytes
 * @param modifiedAt last modification time, may be null
 */
public record StorageObject(
        String key,
        String name,
        long size,
        Instant modifiedAt
) {
}
