package com.ivamare.pgmq.exception;

import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Classifies database exceptions raised while talking to PGMQ.
 *
 * <p>Two questions are answered:
 * <ul>
 *   <li>{@link #isConnectionFailure(Throwable)}: did the transport fail? These are surfaced
 *       to callers as {@link PgmqConnectionException}.</li>
 *   <li>{@link #isTransient(Throwable)}: might the same call succeed if repeated? Used as the
 *       default retry predicate of {@link com.ivamare.pgmq.retry.BoundedRetry}.</li>
 * </ul>
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    /** duplicate_table */
    public static final String DUPLICATE_TABLE = "42P07";

    /** unique_violation, raised when two creates race on the queue metadata row */
    public static final String UNIQUE_VIOLATION = "23505";

    /** undefined_table */
    public static final String UNDEFINED_TABLE = "42P01";

    private DatabaseExceptionClassifier() {
    }

    /**
     * SQL states meaning the connection itself is unusable.
     */
    private static final Set<String> CONNECTION_SQL_STATES = Set.of(
        "08000",  // connection_exception
        "08001",  // sqlclient_unable_to_establish_sqlconnection
        "08003",  // connection_does_not_exist
        "08004",  // sqlserver_rejected_establishment_of_sqlconnection
        "08006",  // connection_failure
        "08007",  // transaction_resolution_unknown
        "08P01",  // protocol_violation
        "57P01",  // admin_shutdown
        "57P02",  // crash_shutdown
        "57P03"   // cannot_connect_now
    );

    /**
     * SQL states that are worth retrying but leave the connection usable.
     */
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "53000",  // insufficient_resources
        "53100",  // disk_full
        "53200",  // out_of_memory
        "53300",  // too_many_connections
        "40001",  // serialization_failure
        "40P01"   // deadlock_detected
    );

    private static final String[] CONNECTION_MESSAGE_PATTERNS = {
        "connection refused",
        "connection reset",
        "connection timed out",
        "connect timed out",
        "connection is not available",
        "connection closed",
        "broken pipe",
        "no route to host",
        "terminating connection",
        "could not connect to server",
        "the database system is starting up",
        "the database system is shutting down"
    };

    /**
     * Determine whether the exception (or one of its causes) is a transport failure.
     *
     * <p>Spring maps server resource and limit errors (classes 53 and 54) to
     * {@code DataAccessResourceFailureException} as well; those are not transport failures,
     * so the Spring type alone is not used here.
     *
     * @param ex the exception to classify
     * @return true if the connection to the database failed
     */
    public static boolean isConnectionFailure(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof CannotGetJdbcConnectionException
                    || current instanceof SQLTransientConnectionException
                    || current instanceof SQLNonTransientConnectionException
                    || current instanceof SQLRecoverableException
                    || current instanceof java.net.ConnectException) {
                return true;
            }
            if (current instanceof SQLException sqlEx) {
                String sqlState = sqlEx.getSQLState();
                if (sqlState != null && CONNECTION_SQL_STATES.contains(sqlState)) {
                    return true;
                }
            }
            if (matchesConnectionMessage(current.getMessage())) {
                return true;
            }
            Throwable cause = current.getCause();
            current = cause != current ? cause : null;
        }
        return false;
    }

    /**
     * Determine if repeating the failed call could succeed.
     *
     * <p>Connection failures are transient: a later attempt gets a new connection from the pool.
     *
     * @param ex the exception to classify
     * @return true if the exception is transient and the call may be retried
     */
    public static boolean isTransient(Throwable ex) {
        if (ex == null) {
            return false;
        }
        if (isConnectionFailure(ex)) {
            return true;
        }
        Throwable current = ex;
        while (current != null) {
            if (current instanceof TransientDataAccessException
                    || current instanceof RecoverableDataAccessException
                    || current instanceof SQLTimeoutException
                    || current instanceof SQLTransientException) {
                return true;
            }
            if (current instanceof SQLException sqlEx) {
                String sqlState = sqlEx.getSQLState();
                if (sqlState != null && TRANSIENT_SQL_STATES.contains(sqlState)) {
                    return true;
                }
            }
            Throwable cause = current.getCause();
            current = cause != current ? cause : null;
        }
        return false;
    }

    /**
     * Get the first SQL state found in the exception chain.
     *
     * @param ex the exception to inspect
     * @return the SQL state code, or null if not available
     */
    public static String getSqlState(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SQLException sqlEx && sqlEx.getSQLState() != null) {
                return sqlEx.getSQLState();
            }
            Throwable cause = current.getCause();
            current = cause != current ? cause : null;
        }
        return null;
    }

    private static boolean matchesConnectionMessage(String message) {
        if (message == null) {
            return false;
        }
        String lowerMessage = message.toLowerCase();
        for (String pattern : CONNECTION_MESSAGE_PATTERNS) {
            if (lowerMessage.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
