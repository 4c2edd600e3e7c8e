package org.javai.backoff.wait;

import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Wait derived from each attempt's outcome.
 *
 * <p>The mapping receives the value returned, or the exception thrown, by the attempt that
 * just completed. Typical use is honouring a server's retry-after hint:
 * <pre>{@code
 * WaitGenerator waits = RuntimeWait.of(outcome ->
 *     outcome instanceof HttpResponse<?> response
 *         ? response.headers().firstValueAsLong("Retry-After").orElse(1)
 *         : 1);
 * }</pre>
 */
public final class RuntimeWait implements WaitGenerator {

    private final ToDoubleFunction<Object> mapping;

    private RuntimeWait(ToDoubleFunction<Object> mapping) {
        this.mapping = mapping;
    }

    public static RuntimeWait of(ToDoubleFunction<Object> mapping) {
        return new RuntimeWait(Objects.requireNonNull(mapping, "mapping must not be null"));
    }

    @Override
    public WaitSequence start() {
        return outcome -> {
            double seconds = mapping.applyAsDouble(outcome);
            if (Double.isNaN(seconds) || seconds < 0) {
                throw new IllegalArgumentException(
                        "runtime wait must be >= 0 seconds, was: " + seconds);
            }
            return seconds;
        };
    }
}
