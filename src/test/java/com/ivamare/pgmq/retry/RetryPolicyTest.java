package com.ivamare.pgmq.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    @DisplayName("fixed policy should wait the same delay before every retry")
    void fixedPolicyShouldRepeatDelay() {
        RetryPolicy policy = RetryPolicy.fixed(5, Duration.ofSeconds(2));

        assertEquals(Duration.ofSeconds(2), policy.getBackoff(1));
        assertEquals(Duration.ofSeconds(2), policy.getBackoff(4));
        assertEquals(Duration.ZERO, policy.getBackoff(5));
    }

    @Test
    @DisplayName("exponential policy should grow and respect the cap")
    void exponentialPolicyShouldGrowUpToMax() {
        RetryPolicy policy = RetryPolicy.exponential(5, Duration.ofMillis(100), 2.0, Duration.ofMillis(500));

        assertEquals(List.of(
            Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400), Duration.ofMillis(500)
        ), policy.backoffSchedule());
    }

    @Test
    @DisplayName("should reuse the last delay when the schedule is shorter than the attempts")
    void shouldRepeatLastDelay() {
        RetryPolicy policy = new RetryPolicy(6, List.of(Duration.ofSeconds(1), Duration.ofSeconds(3)));

        assertEquals(Duration.ofSeconds(1), policy.getBackoff(1));
        assertEquals(Duration.ofSeconds(3), policy.getBackoff(2));
        assertEquals(Duration.ofSeconds(3), policy.getBackoff(5));
    }

    @Test
    @DisplayName("shouldRetry should stop at max attempts")
    void shouldRetryUntilMaxAttempts() {
        RetryPolicy policy = RetryPolicy.fixed(3, Duration.ZERO);

        assertTrue(policy.shouldRetry(1));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
    }

    @Test
    @DisplayName("noRetry should allow a single attempt")
    void noRetryShouldAllowSingleAttempt() {
        RetryPolicy policy = RetryPolicy.noRetry();

        assertEquals(1, policy.maxAttempts());
        assertFalse(policy.shouldRetry(1));
        assertEquals(Duration.ZERO, policy.getBackoff(1));
    }

    @Test
    @DisplayName("should reject invalid settings")
    void shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(3, Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class,
            () -> RetryPolicy.exponential(3, Duration.ofSeconds(1), 0.5, Duration.ofSeconds(10)));
    }

    @Test
    @DisplayName("backoff schedule should be immutable")
    void scheduleShouldBeImmutable() {
        List<Duration> schedule = new ArrayList<>(List.of(Duration.ofSeconds(1)));
        RetryPolicy policy = new RetryPolicy(3, schedule);
        schedule.add(Duration.ofSeconds(9));

        assertEquals(1, policy.backoffSchedule().size());
        assertThrows(UnsupportedOperationException.class, () -> policy.backoffSchedule().add(Duration.ZERO));
    }
}
