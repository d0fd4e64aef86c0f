package com.ivamare.pgmq.exception;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;

/**
 * Maps Spring data access failures onto the PGMQ exception taxonomy.
 *
 * <ul>
 *   <li>transport failures → {@link PgmqConnectionException}</li>
 *   <li>undefined_table (42P01) → {@link QueueNotFoundException}</li>
 *   <li>duplicate_table (42P07) or a duplicate key while creating → {@link QueueAlreadyExistsException}</li>
 *   <li>anything else → {@link PgmqException} carrying the original cause</li>
 * </ul>
 */
public final class PgmqExceptionTranslator {

    private PgmqExceptionTranslator() {
    }

    /**
     * Translate a failure raised by a queue operation.
     *
     * @param operation short operation name used in the message, e.g. {@code "read"}
     * @param queueName the queue the operation targeted, may be null for queue-less operations
     * @param ex the failure raised by JdbcTemplate
     * @return the exception to throw
     */
    public static PgmqException translate(String operation, String queueName, DataAccessException ex) {
        if (DatabaseExceptionClassifier.isConnectionFailure(ex)) {
            return new PgmqConnectionException(
                "Connection failure during " + operation + describeQueue(queueName) + ": " + ex.getMessage(), ex);
        }

        String sqlState = DatabaseExceptionClassifier.getSqlState(ex);
        if (queueName != null) {
            if (DatabaseExceptionClassifier.UNDEFINED_TABLE.equals(sqlState)) {
                return new QueueNotFoundException(queueName, ex);
            }
            if (isCreate(operation)
                    && (ex instanceof DuplicateKeyException
                        || DatabaseExceptionClassifier.DUPLICATE_TABLE.equals(sqlState)
                        || DatabaseExceptionClassifier.UNIQUE_VIOLATION.equals(sqlState))) {
                return new QueueAlreadyExistsException(queueName, ex);
            }
        }

        return new PgmqException(
            "Failed to " + operation + describeQueue(queueName) + ": " + ex.getMessage(), ex);
    }

    private static boolean isCreate(String operation) {
        return operation.startsWith("create");
    }

    private static String describeQueue(String queueName) {
        return queueName != null ? " on queue " + queueName : "";
    }
}
