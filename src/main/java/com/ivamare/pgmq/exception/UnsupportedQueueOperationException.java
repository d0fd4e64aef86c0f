package com.ivamare.pgmq.exception;

import com.ivamare.pgmq.client.PgmqDialect;

/**
 * Thrown when the configured PGMQ dialect cannot perform the requested operation.
 *
 * <p>Raised before any statement is sent, so an unsupported option is never
 * silently dropped.
 */
public class UnsupportedQueueOperationException extends PgmqException {

    private final String operation;
    private final PgmqDialect dialect;

    public UnsupportedQueueOperationException(String operation, PgmqDialect dialect) {
        super(operation + " is not supported by the " + dialect + " PGMQ dialect");
        this.operation = operation;
        this.dialect = dialect;
    }

    public String getOperation() {
        return operation;
    }

    public PgmqDialect getDialect() {
        return dialect;
    }
}
