package com.foreman.core.resilience;

import java.time.Duration;

/**
 * Waits between retry attempts. Replaced in tests to record delays instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
