package org.javai.backoff.retry;

import org.javai.backoff.Arguments;
import org.javai.backoff.AsyncOperation;
import org.javai.backoff.Operation;
import org.javai.backoff.ThrowingSupplier;
import org.javai.backoff.wait.WaitGenerator;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Calls an operation until its result no longer satisfies a retry predicate.
 *
 * <p>Giving up is not a failure: the last result is returned as is. Exceptions thrown by the
 * operation are not retried and reach the caller unchanged.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * PredicateRetrier<JobStatus> poller = Backoff.<JobStatus>onPredicate(WaitGenerators.fibo(30))
 *     .predicate(status -> status == JobStatus.RUNNING)
 *     .maxTime(Duration.ofMinutes(5))
 *     .build();
 *
 * JobStatus status = poller.call("pollJob", () -> jobs.status(jobId));
 * }</pre>
 *
 * <p>A retrier is immutable and thread-safe; concurrent calls never share retry state.
 *
 * @param <T> The type of result
 */
public final class PredicateRetrier<T> {

    private final RetryConfiguration configuration;
    private final Predicate<? super T> predicate;

    private PredicateRetrier(RetryConfiguration configuration, Predicate<? super T> predicate) {
        this.configuration = configuration;
        this.predicate = predicate;
    }

    /**
     * Creates a builder for a predicate-triggered retrier.
     *
     * @param waitGenerator the wait schedule between attempts
     * @return a new builder
     */
    public static <T> Builder<T> builder(WaitGenerator waitGenerator) {
        return new Builder<>(waitGenerator);
    }

    public RetryConfiguration configuration() {
        return configuration;
    }

    /**
     * Calls an operation, retrying as configured.
     *
     * @param target name of the operation, for observers
     * @param operation the operation
     * @param arguments arguments passed unchanged to every attempt
     * @return the first result that does not satisfy the predicate, or the last result on give-up
     * @throws Exception whatever the operation throws, unchanged
     */
    public T call(String target, Operation<? extends T> operation, Arguments arguments) throws Exception {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");

        PredicateStateMachine<T> machine = new PredicateStateMachine<>(configuration, target, arguments, predicate);
        return BlockingRetryLoop.run(machine, operation, arguments, configuration.sleeper());
    }

    /**
     * Calls argument-less work, retrying as configured.
     */
    public T call(String target, ThrowingSupplier<? extends T, ? extends Exception> work) throws Exception {
        return call(target, Operation.of(work), Arguments.empty());
    }

    /**
     * Calls an asynchronous operation, retrying as configured without blocking.
     *
     * @return a future of the same value {@link #call} would return, or failed with the
     *         operation's exception
     */
    public CompletableFuture<T> callAsync(String target, AsyncOperation<? extends T> operation, Arguments arguments) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");

        PredicateStateMachine<T> machine;
        try {
            machine = new PredicateStateMachine<>(configuration, target, arguments, predicate);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return new AsyncRetryLoop<>(machine, operation, arguments, configuration.delayer()).start();
    }

    /**
     * Binds an operation to this retrier.
     */
    public RetryingOperation<T> bind(String target, Operation<? extends T> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        return new RetryingOperation<>(target, arguments -> call(target, operation, arguments));
    }

    /**
     * Binds an asynchronous operation to this retrier.
     */
    public AsyncRetryingOperation<T> bindAsync(String target, AsyncOperation<? extends T> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        return new AsyncRetryingOperation<>(target, arguments -> callAsync(target, operation, arguments));
    }

    /**
     * Builder for {@link PredicateRetrier}. The default predicate retries on
     * {@link RetryPredicates#falsy() falsy} results.
     */
    public static final class Builder<T> extends RetryConfiguration.Builder<Builder<T>> {
        private Predicate<? super T> predicate = RetryPredicates.falsy();

        private Builder(WaitGenerator waitGenerator) {
            super(waitGenerator);
        }

        @Override
        protected Builder<T> self() {
            return this;
        }

        /**
         * Sets the predicate; the operation is called again while it returns true.
         *
         * @param predicate test of the latest result
         * @return this builder
         */
        public Builder<T> predicate(Predicate<? super T> predicate) {
            this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
            return this;
        }

        public PredicateRetrier<T> build() {
            return new PredicateRetrier<>(configuration(), predicate);
        }
    }
}
