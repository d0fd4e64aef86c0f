package com.ivamare.pgmq.model;

/**
 * Point-in-time statistics for a queue as reported by the extension.
 *
 * @param queueName Queue the metrics belong to
 * @param queueLength Messages currently in the queue, visible or not
 * @param newestMessageAgeSeconds Age of the newest message, null when the queue is empty
 * @param oldestMessageAgeSeconds Age of the oldest message, null when the queue is empty
 */
public record QueueMetrics(
    String queueName,
    long queueLength,
    Integer newestMessageAgeSeconds,
    Integer oldestMessageAgeSeconds
) {

    public boolean isEmpty() {
        return queueLength == 0;
    }
}
