package com.ivamare.pgmq.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message from a PGMQ queue.
 *
 * @param msgId Unique message ID assigned by PGMQ
 * @param readCount Number of times this message has been read
 * @param enqueuedAt When the message was enqueued
 * @param visibilityTimeout When the message becomes visible again
 * @param message The message payload
 */
public record PgmqMessage(
    long msgId,
    int readCount,
    Instant enqueuedAt,
    Instant visibilityTimeout,
    Map<String, Object> message
) {
    /**
     * Creates a PgmqMessage with an unmodifiable copy of the message data.
     * JSON nulls are kept, so {@code Map.copyOf} cannot be used here.
     */
    public PgmqMessage {
        message = message != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(message))
            : Map.of();
    }
}
