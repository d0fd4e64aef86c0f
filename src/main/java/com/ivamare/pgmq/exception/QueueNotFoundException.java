package com.ivamare.pgmq.exception;

/**
 * Thrown when an operation targets a queue that does not exist.
 */
public class QueueNotFoundException extends PgmqException {

    private final String queueName;

    public QueueNotFoundException(String queueName, Throwable cause) {
        super("Queue " + queueName + " not found", cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
