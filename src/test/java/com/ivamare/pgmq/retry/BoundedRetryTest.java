package com.ivamare.pgmq.retry;

import com.ivamare.pgmq.exception.DatabaseExceptionClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundedRetryTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    @BeforeEach
    void setUp() {
        sleeps.clear();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void shouldReturnImmediatelyOnSuccess() {
        BoundedRetry retry = new BoundedRetry(RetryPolicy.fixed(5, Duration.ofSeconds(2)),
            e -> true, recordingSleeper);

        assertEquals("ok", retry.execute("noop", () -> "ok"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldRetryTransientFailuresUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        BoundedRetry retry = new BoundedRetry(RetryPolicy.fixed(5, Duration.ofSeconds(2)),
            e -> e instanceof CannotGetJdbcConnectionException, recordingSleeper);

        String result = retry.execute("connect", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new CannotGetJdbcConnectionException("database starting");
            }
            return "connected";
        });

        assertEquals("connected", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void shouldRethrowLastFailureWhenAttemptsRunOut() {
        AtomicInteger calls = new AtomicInteger();
        CannotGetJdbcConnectionException failure = new CannotGetJdbcConnectionException("down");
        BoundedRetry retry = new BoundedRetry(RetryPolicy.fixed(3, Duration.ofMillis(10)),
            e -> true, recordingSleeper);

        CannotGetJdbcConnectionException thrown = assertThrows(CannotGetJdbcConnectionException.class,
            () -> retry.run("connect", () -> {
                calls.incrementAndGet();
                throw failure;
            }));

        assertSame(failure, thrown);
        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size());
    }

    @Test
    void shouldNotRetryPermanentFailures() {
        AtomicInteger calls = new AtomicInteger();
        BoundedRetry retry = new BoundedRetry(RetryPolicy.fixed(5, Duration.ofSeconds(1)),
            DatabaseExceptionClassifier::isTransient, recordingSleeper);

        assertThrows(DataIntegrityViolationException.class, () -> retry.run("insert", () -> {
            calls.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate");
        }));

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void defaultPredicateShouldRetryConnectionFailures() {
        AtomicInteger calls = new AtomicInteger();
        BoundedRetry retry = new BoundedRetry(RetryPolicy.fixed(2, Duration.ZERO));

        assertThrows(CannotGetJdbcConnectionException.class, () -> retry.run("connect", () -> {
            calls.incrementAndGet();
            throw new CannotGetJdbcConnectionException("refused");
        }));

        assertEquals(2, calls.get());
    }

    @Test
    void shouldStopAndRestoreInterruptWhenSleepIsInterrupted() {
        AtomicInteger calls = new AtomicInteger();
        Sleeper interrupting = duration -> {
            throw new InterruptedException("shutdown");
        };
        BoundedRetry retry = new BoundedRetry(RetryPolicy.fixed(5, Duration.ofSeconds(1)), e -> true, interrupting);

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> retry.run("work", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("busy");
        }));

        assertEquals(1, calls.get());
        assertTrue(Thread.currentThread().isInterrupted());
        assertEquals(1, thrown.getSuppressed().length);
        assertInstanceOf(InterruptedException.class, thrown.getSuppressed()[0]);
    }
}
