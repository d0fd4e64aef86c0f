package com.ivamare.pgmq.retry;

import java.time.Duration;

/**
 * Waits between retry attempts. Replaced in tests to avoid real sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
