package com.ivamare.pgmq.client;

import com.ivamare.pgmq.model.PartitionOptions;
import com.ivamare.pgmq.model.PgmqMessage;
import com.ivamare.pgmq.model.QueueInfo;
import com.ivamare.pgmq.model.QueueMetrics;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for interacting with PGMQ queues.
 *
 * <p>Wraps PGMQ SQL functions. Every method is a single synchronous round trip on a pooled
 * connection; nothing is retried. Visibility timeouts, read counts and partitioning are
 * enforced by the extension, not by this client.
 *
 * <p>Failures surface as {@link com.ivamare.pgmq.exception.PgmqException} subtypes:
 * {@link com.ivamare.pgmq.exception.PgmqConnectionException} for transport failures,
 * {@link com.ivamare.pgmq.exception.QueueNotFoundException},
 * {@link com.ivamare.pgmq.exception.QueueAlreadyExistsException},
 * {@link com.ivamare.pgmq.exception.UnsupportedQueueOperationException} and
 * {@link com.ivamare.pgmq.exception.InvalidQueueNameException}.
 */
public interface PgmqClient {

    /**
     * Create a queue.
     *
     * @param queueName Name of the queue to create
     * @throws com.ivamare.pgmq.exception.QueueAlreadyExistsException if the queue already exists
     */
    void createQueue(String queueName);

    /**
     * Create a partitioned queue with default partition options.
     *
     * @param queueName Name of the queue to create
     */
    void createPartitionedQueue(String queueName);

    /**
     * Create a partitioned queue.
     *
     * @param queueName Name of the queue to create
     * @param options Partition size and retention
     * @throws com.ivamare.pgmq.exception.QueueAlreadyExistsException if the queue already exists
     */
    void createPartitionedQueue(String queueName, PartitionOptions options);

    /**
     * Drop a queue together with its archive.
     *
     * @param queueName Name of the queue
     * @return true if the queue existed and was dropped
     */
    boolean dropQueue(String queueName);

    /**
     * List all queues.
     *
     * @return queues known to the extension, possibly empty
     */
    List<QueueInfo> listQueues();

    /**
     * Send a message to a queue.
     *
     * @param queueName Name of the queue
     * @param message Message payload (will be JSON serialized)
     * @return Message ID assigned by PGMQ
     */
    long send(String queueName, Map<String, Object> message);

    /**
     * Send a message to a queue with delay.
     *
     * @param queueName Name of the queue
     * @param message Message payload (will be JSON serialized)
     * @param delaySeconds Delay in seconds before message becomes visible
     * @return Message ID assigned by PGMQ
     * @throws com.ivamare.pgmq.exception.UnsupportedQueueOperationException if the delay is
     *         positive and the dialect cannot delay messages
     */
    long send(String queueName, Map<String, Object> message, int delaySeconds);

    /**
     * Send multiple messages to a queue in a single statement.
     *
     * @param queueName Name of the queue
     * @param messages List of message payloads
     * @return List of message IDs, in payload order
     */
    List<Long> sendBatch(String queueName, List<Map<String, Object>> messages);

    /**
     * Send multiple messages with delay.
     *
     * @param queueName Name of the queue
     * @param messages List of message payloads
     * @param delaySeconds Delay in seconds
     * @return List of message IDs
     */
    List<Long> sendBatch(String queueName, List<Map<String, Object>> messages, int delaySeconds);

    /**
     * Read messages from a queue.
     *
     * <p>Each returned message stays invisible to other readers until
     * {@code now + visibilityTimeoutSeconds}. An empty list means nothing is visible right now;
     * callers poll.
     *
     * @param queueName Name of the queue
     * @param visibilityTimeoutSeconds Seconds before message becomes visible again
     * @param limit Maximum number of messages to read
     * @return List of messages (may be empty)
     */
    List<PgmqMessage> read(String queueName, int visibilityTimeoutSeconds, int limit);

    /**
     * Read a single message from a queue.
     *
     * @param queueName Name of the queue
     * @param visibilityTimeoutSeconds Visibility timeout in seconds
     * @return Optional message (empty if no message is visible)
     */
    default Optional<PgmqMessage> readOne(String queueName, int visibilityTimeoutSeconds) {
        var messages = read(queueName, visibilityTimeoutSeconds, 1);
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(0));
    }

    /**
     * Read a single message using the client's default visibility timeout.
     *
     * @param queueName Name of the queue
     * @return Optional message (empty if no message is visible)
     */
    Optional<PgmqMessage> readOne(String queueName);

    /**
     * Read a message and delete it in the same statement.
     *
     * @param queueName Name of the queue
     * @return Optional message (empty if no message is visible)
     */
    Optional<PgmqMessage> pop(String queueName);

    /**
     * Set visibility timeout for a message.
     *
     * @param queueName Name of the queue
     * @param msgId Message ID
     * @param visibilityTimeoutSeconds New visibility timeout in seconds from now
     * @return the updated message, empty if no message has that ID
     */
    Optional<PgmqMessage> setVisibilityTimeout(String queueName, long msgId, int visibilityTimeoutSeconds);

    /**
     * Delete a message from a queue.
     *
     * @param queueName Name of the queue
     * @param msgId Message ID to delete
     * @return true if message was deleted, false if not found
     */
    boolean delete(String queueName, long msgId);

    /**
     * Archive a message (move to archive table).
     *
     * @param queueName Name of the queue
     * @param msgId Message ID to archive
     * @return true if message was archived, false if not found
     */
    boolean archive(String queueName, long msgId);

    /**
     * Get a message from the archive.
     *
     * @param queueName Name of the queue
     * @param msgId Message ID
     * @return Optional archived message
     */
    Optional<PgmqMessage> readArchived(String queueName, long msgId);

    /**
     * Get queue statistics.
     *
     * @param queueName Name of the queue
     * @return metrics reported by the extension
     */
    QueueMetrics metrics(String queueName);

    /**
     * @return the SQL dialect this client speaks
     */
    PgmqDialect dialect();
}
