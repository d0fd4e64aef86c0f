package com.ivamare.pgmq.model;

/**
 * Options for creating a partitioned queue.
 *
 * <p>Each field maps to a fixed positional parameter of the create statement.
 *
 * @param partitionSize Number of message ids per partition
 * @param retentionInterval Number of message ids to retain before old partitions are dropped,
 *                          or null for the extension's default
 */
public record PartitionOptions(
    long partitionSize,
    Long retentionInterval
) {

    /** Partition size used when none is configured. */
    public static final long DEFAULT_PARTITION_SIZE = 5000;

    public PartitionOptions {
        if (partitionSize <= 0) {
            throw new IllegalArgumentException("partitionSize must be positive, got " + partitionSize);
        }
        if (retentionInterval != null && retentionInterval <= 0) {
            throw new IllegalArgumentException("retentionInterval must be positive, got " + retentionInterval);
        }
    }

    public static PartitionOptions defaults() {
        return new PartitionOptions(DEFAULT_PARTITION_SIZE, null);
    }

    public static PartitionOptions ofSize(long partitionSize) {
        return new PartitionOptions(partitionSize, null);
    }

    public PartitionOptions withRetentionInterval(long retentionInterval) {
        return new PartitionOptions(partitionSize, retentionInterval);
    }

    public boolean hasRetentionInterval() {
        return retentionInterval != null;
    }
}
