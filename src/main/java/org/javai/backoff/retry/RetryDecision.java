package org.javai.backoff.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * What a retry loop does after an attempt has been evaluated.
 */
sealed interface RetryDecision<T> permits RetryDecision.Complete, RetryDecision.Raise, RetryDecision.Backoff {

    /**
     * Stop and return the value.
     */
    record Complete<T>(T value) implements RetryDecision<T> {}

    /**
     * Stop and rethrow the exception.
     */
    record Raise<T>(Exception exception) implements RetryDecision<T> {
        public Raise {
            Objects.requireNonNull(exception, "exception must not be null");
        }
    }

    /**
     * Sleep, then attempt again.
     */
    record Backoff<T>(double seconds) implements RetryDecision<T> {
        public Backoff {
            if (Double.isNaN(seconds) || seconds < 0) {
                throw new IllegalArgumentException("seconds must not be negative");
            }
        }

        Duration delay() {
            return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
        }
    }
}
