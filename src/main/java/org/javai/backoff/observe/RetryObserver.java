package org.javai.backoff.observe;

/**
 * Receives the {@link Details} of a retry lifecycle event.
 *
 * <p>Observers run on the thread driving the retry loop, in registration order. An exception
 * thrown by an observer is not caught: it aborts the retry loop and reaches the caller.
 * Observers shared between retriers must be thread-safe.
 */
@FunctionalInterface
public interface RetryObserver {

    void onEvent(Details details);
}
