package com.ivamare.pgmq.exception;

/**
 * Base exception for all PGMQ client errors.
 */
public class PgmqException extends RuntimeException {

    public PgmqException(String message) {
        super(message);
    }

    public PgmqException(String message, Throwable cause) {
        super(message, cause);
    }
}
