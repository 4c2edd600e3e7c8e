package org.javai.backoff.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread between attempts.
 */
@FunctionalInterface
interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    }
}
