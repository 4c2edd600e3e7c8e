package org.javai.backoff.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Suspends an asynchronous retry loop between attempts without blocking a thread.
 */
@FunctionalInterface
interface Delayer {

    /**
     * Returns a future completing once {@code duration} has passed. Cancelling it aborts the retry loop.
     */
    CompletableFuture<Void> delay(Duration duration);

    /**
     * Delays on {@link CompletableFuture#delayedExecutor}. Zero delays still hop to the
     * executor, so long runs of immediate retries do not grow the stack.
     */
    static Delayer defaultDelayer() {
        return duration -> CompletableFuture.runAsync(() -> {},
                CompletableFuture.delayedExecutor(duration.toNanos(), TimeUnit.NANOSECONDS));
    }
}
