package com.ivamare.pgmq.retry;

import com.ivamare.pgmq.exception.DatabaseExceptionClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs an action up to {@link RetryPolicy#maxAttempts()} times.
 *
 * <p>Only failures accepted by the retry predicate are retried; anything else propagates
 * immediately. When attempts run out the last failure is rethrown unchanged. An interrupt
 * while waiting stops retrying, restores the interrupt flag and rethrows the last failure.
 *
 * <p>The PGMQ client itself never retries. This utility is for callers, e.g. schema setup on
 * startup while the database is still coming up:
 * <pre>
 * BoundedRetry retry = new BoundedRetry(RetryPolicy.fixed(5, Duration.ofSeconds(2)));
 * retry.run("create queue", () -> client.createQueue("orders"));
 * </pre>
 */
public class BoundedRetry {

    private static final Logger log = LoggerFactory.getLogger(BoundedRetry.class);

    private final RetryPolicy policy;
    private final Predicate<Throwable> retryOn;
    private final Sleeper sleeper;

    /**
     * Retry transient database failures according to {@code policy}.
     */
    public BoundedRetry(RetryPolicy policy) {
        this(policy, DatabaseExceptionClassifier::isTransient, Sleeper.THREAD);
    }

    public BoundedRetry(RetryPolicy policy, Predicate<Throwable> retryOn) {
        this(policy, retryOn, Sleeper.THREAD);
    }

    public BoundedRetry(RetryPolicy policy, Predicate<Throwable> retryOn, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.retryOn = Objects.requireNonNull(retryOn, "retryOn");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Execute the action, retrying retryable failures.
     *
     * @param description what is being attempted, used in log messages
     * @param action the action to run
     * @param <T> result type
     * @return the action's result from the first successful attempt
     */
    public <T> T execute(String description, Supplier<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                T result = action.get();
                if (attempt > 1) {
                    log.info("{} succeeded on attempt {}/{}", description, attempt, policy.maxAttempts());
                }
                return result;
            } catch (RuntimeException e) {
                if (!retryOn.test(e)) {
                    throw e;
                }
                if (!policy.shouldRetry(attempt)) {
                    log.error("{} failed after {} attempt(s): {}", description, attempt, e.getMessage());
                    throw e;
                }

                Duration backoff = policy.getBackoff(attempt);
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                    description, attempt, policy.maxAttempts(), backoff.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }

    /**
     * Run an action without a result, retrying retryable failures.
     *
     * @param description what is being attempted, used in log messages
     * @param action the action to run
     */
    public void run(String description, Runnable action) {
        execute(description, () -> {
            action.run();
            return null;
        });
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
