package com.ivamare.pgmq.exception;

/**
 * Thrown when a queue name cannot be used as part of a table name.
 */
public class InvalidQueueNameException extends PgmqException {

    private final String queueName;

    public InvalidQueueNameException(String queueName, String reason) {
        super("Invalid queue name '" + queueName + "': " + reason);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
