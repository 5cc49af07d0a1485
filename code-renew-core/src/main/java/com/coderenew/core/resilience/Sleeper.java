package com.coderenew.core.resilience;

import java.time.Duration;

/**
 * Blocks the current thread between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps for the given duration.
     *
     * @param duration time to sleep
     * @throws InterruptedException if interrupted while sleeping
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeper backed by {@link Thread#sleep(long)}.
     *
     * @return thread sleeper
     */
    static Sleeper threadSleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
