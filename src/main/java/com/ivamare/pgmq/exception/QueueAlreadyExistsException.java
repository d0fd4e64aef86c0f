package com.ivamare.pgmq.exception;

/**
 * Thrown when creating a queue whose name is already taken.
 */
public class QueueAlreadyExistsException extends PgmqException {

    private final String queueName;

    public QueueAlreadyExistsException(String queueName) {
        super("Queue " + queueName + " already exists");
        this.queueName = queueName;
    }

    public QueueAlreadyExistsException(String queueName, Throwable cause) {
        super("Queue " + queueName + " already exists", cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
