package com.ivamare.pgmq.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Policy for bounded retries.
 *
 * @param maxAttempts Maximum number of attempts, including the first one
 * @param backoffSchedule Delay before each retry; the last entry repeats once the schedule runs out
 */
public record RetryPolicy(
    int maxAttempts,
    List<Duration> backoffSchedule
) {
    /**
     * Creates a RetryPolicy with immutable backoff schedule.
     */
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        backoffSchedule = List.copyOf(backoffSchedule);
        for (Duration delay : backoffSchedule) {
            if (delay.isNegative()) {
                throw new IllegalArgumentException("backoff delays must not be negative, got " + delay);
            }
        }
    }

    /**
     * Same delay between every attempt.
     *
     * @param maxAttempts Maximum number of attempts
     * @param delay Delay between attempts
     * @return Fixed-delay policy
     */
    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, List.of(delay));
    }

    /**
     * Delay multiplied after every failed attempt, capped at {@code max}.
     *
     * @param maxAttempts Maximum number of attempts
     * @param initial Delay before the first retry
     * @param multiplier Growth factor, at least 1
     * @param max Upper bound for a single delay
     * @return Exponential policy
     */
    public static RetryPolicy exponential(int maxAttempts, Duration initial, double multiplier, Duration max) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1, got " + multiplier);
        }
        List<Duration> schedule = new ArrayList<>();
        double delayMs = initial.toMillis();
        for (int retry = 1; retry < maxAttempts; retry++) {
            schedule.add(Duration.ofMillis(Math.min((long) delayMs, max.toMillis())));
            delayMs *= multiplier;
        }
        return new RetryPolicy(maxAttempts, schedule);
    }

    /**
     * Create a policy with no retries.
     *
     * @return No retry policy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, List.of());
    }

    /**
     * Get the delay to wait after a failed attempt.
     *
     * @param attempt The attempt that just failed (1-based)
     * @return Delay before the next attempt, zero if no more attempts are allowed
     */
    public Duration getBackoff(int attempt) {
        if (attempt >= maxAttempts || backoffSchedule.isEmpty()) {
            return Duration.ZERO;
        }
        int index = Math.max(attempt - 1, 0);
        if (index < backoffSchedule.size()) {
            return backoffSchedule.get(index);
        }
        return backoffSchedule.get(backoffSchedule.size() - 1);
    }

    /**
     * Check if another attempt should be made.
     *
     * @param attempt The attempt that just failed (1-based)
     * @return true if more attempts are allowed
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }
}
