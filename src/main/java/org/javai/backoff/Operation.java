package org.javai.backoff;

import java.util.Objects;

/**
 * The work retried by a blocking retrier.
 *
 * <p>The same {@link Arguments} instance is passed to every attempt.
 *
 * @param <T> The type of result
 */
@FunctionalInterface
public interface Operation<T> {

    T invoke(Arguments arguments) throws Exception;

    /**
     * Adapts argument-less work to an operation.
     */
    static <T> Operation<T> of(ThrowingSupplier<? extends T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        return arguments -> work.get();
    }
}
