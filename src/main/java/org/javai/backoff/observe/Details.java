package org.javai.backoff.observe;

import org.javai.backoff.Arguments;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Describes one lifecycle event of a retried call. Passed to every observer.
 *
 * @param target The name the retried operation was bound under
 * @param arguments The arguments of the call, identical for every attempt
 * @param tries Attempts completed so far; the try event sees the count before the attempt
 * @param elapsed Seconds since just before the first attempt
 * @param waitSeconds Seconds about to be slept (backoff events only, otherwise null)
 * @param value The result being judged (predicate-triggered retries only, otherwise null)
 * @param exception The caught exception (exception-triggered retries only, otherwise null)
 */
public record Details(
        String target,
        Arguments arguments,
        int tries,
        double elapsed,
        Double waitSeconds,
        Object value,
        Exception exception
) {
    public Details {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
        if (tries < 0) {
            throw new IllegalArgumentException("tries must be >= 0");
        }
    }

    public List<Object> args() {
        return arguments.positional();
    }

    public Map<String, Object> kwargs() {
        return arguments.keyword();
    }

    public boolean hasWait() {
        return waitSeconds != null;
    }

    public Duration elapsedDuration() {
        return seconds(elapsed);
    }

    /**
     * The wait as a duration, or null if this is not a backoff event.
     */
    public Duration waitDuration() {
        return waitSeconds == null ? null : seconds(waitSeconds);
    }

    private static Duration seconds(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }
}
