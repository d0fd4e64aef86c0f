package com.ivamare.pgmq.model;

import java.time.Instant;

/**
 * A queue known to the PGMQ extension.
 *
 * @param queueName Name the queue was created with
 * @param partitioned Whether the queue table is partitioned
 * @param createdAt When the queue was created
 */
public record QueueInfo(
    String queueName,
    boolean partitioned,
    Instant createdAt
) {
}
