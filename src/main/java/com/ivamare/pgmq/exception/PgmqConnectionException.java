package com.ivamare.pgmq.exception;

/**
 * Thrown when the database cannot be reached or the connection breaks mid-call.
 *
 * <p>The client never retries; wrap the call in a
 * {@link com.ivamare.pgmq.retry.BoundedRetry} if the caller wants to.
 */
public class PgmqConnectionException extends PgmqException {

    public PgmqConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
