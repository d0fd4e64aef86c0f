package com.ivamare.pgmq.client;

import com.ivamare.pgmq.exception.InvalidQueueNameException;

import java.util.regex.Pattern;

/**
 * Queue naming rules.
 *
 * <p>PGMQ builds table names from queue names, so a name is only accepted when it is made of
 * ASCII letters, digits and underscores and leaves room for the table prefix within
 * PostgreSQL's 63 byte identifier limit.
 */
public final class QueueNames {

    private QueueNames() {
        // Utility class - prevent instantiation
    }

    /** Longest queue name the extension accepts. */
    public static final int MAX_LENGTH = 47;

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_]+");

    /**
     * Check that a queue name is safe to use.
     *
     * @param queueName the queue name
     * @return the same name, for chaining
     * @throws InvalidQueueNameException if the name is null, empty, too long or contains other characters
     */
    public static String validate(String queueName) {
        if (queueName == null || queueName.isEmpty()) {
            throw new InvalidQueueNameException(String.valueOf(queueName), "must not be empty");
        }
        if (queueName.length() > MAX_LENGTH) {
            throw new InvalidQueueNameException(queueName, "must be at most " + MAX_LENGTH + " characters");
        }
        if (!VALID_NAME.matcher(queueName).matches()) {
            throw new InvalidQueueNameException(queueName, "only letters, digits and underscores are allowed");
        }
        return queueName;
    }

    /**
     * Check a queue name without throwing.
     *
     * @param queueName the queue name
     * @return true if {@link #validate(String)} would accept it
     */
    public static boolean isValid(String queueName) {
        return queueName != null
            && !queueName.isEmpty()
            && queueName.length() <= MAX_LENGTH
            && VALID_NAME.matcher(queueName).matches();
    }
}
