package org.javai.backoff.retry;

import org.javai.backoff.Arguments;
import org.javai.backoff.AsyncOperation;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * An asynchronous operation bound to a retrier: each call runs a full retry loop.
 *
 * @param <T> The type of result
 */
public final class AsyncRetryingOperation<T> implements AsyncOperation<T> {

    private final String target;
    private final Function<Arguments, CompletableFuture<T>> retrying;

    AsyncRetryingOperation(String target, Function<Arguments, CompletableFuture<T>> retrying) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.retrying = Objects.requireNonNull(retrying, "retrying must not be null");
    }

    public String target() {
        return target;
    }

    /**
     * Calls the operation with positional arguments, retrying as configured.
     */
    public CompletableFuture<T> call(Object... args) {
        return invoke(Arguments.of(args));
    }

    @Override
    public CompletableFuture<T> invoke(Arguments arguments) {
        return retrying.apply(Objects.requireNonNull(arguments, "arguments must not be null"));
    }
}
