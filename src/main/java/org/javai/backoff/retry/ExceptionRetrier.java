package org.javai.backoff.retry;

import org.javai.backoff.Arguments;
import org.javai.backoff.AsyncOperation;
import org.javai.backoff.Operation;
import org.javai.backoff.ThrowingSupplier;
import org.javai.backoff.wait.WaitGenerator;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Calls an operation until it stops throwing one of the trigger exception types.
 *
 * <p>On give-up the last trigger exception is rethrown, unless {@code raiseOnGiveup(false)}
 * was configured, in which case null is returned. Exceptions of other types reach the
 * caller on first occurrence.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ExceptionRetrier retrier = Backoff.onException(WaitGenerators.expo(), IOException.class)
 *     .maxTries(5)
 *     .giveup(e -> e instanceof FileNotFoundException)
 *     .build();
 *
 * String body = retrier.call("download", () -> client.get(uri));
 * }</pre>
 *
 * <p>A retrier is immutable and thread-safe; concurrent calls never share retry state.
 */
public final class ExceptionRetrier {

    private final RetryConfiguration configuration;
    private final List<Class<? extends Exception>> triggers;
    private final Predicate<? super Exception> giveup;
    private final boolean raiseOnGiveup;

    private ExceptionRetrier(Builder builder) {
        this.configuration = builder.configuration();
        this.triggers = builder.triggers;
        this.giveup = builder.giveup;
        this.raiseOnGiveup = builder.raiseOnGiveup;
    }

    /**
     * Creates a builder for an exception-triggered retrier.
     *
     * @param waitGenerator the wait schedule between attempts
     * @param triggers the exception types that cause a retry (at least one)
     * @return a new builder
     */
    public static Builder builder(WaitGenerator waitGenerator, Collection<Class<? extends Exception>> triggers) {
        return new Builder(waitGenerator, triggers);
    }

    public RetryConfiguration configuration() {
        return configuration;
    }

    public List<Class<? extends Exception>> triggers() {
        return triggers;
    }

    /**
     * Calls an operation, retrying as configured.
     *
     * @param target name of the operation, for observers
     * @param operation the operation
     * @param arguments arguments passed unchanged to every attempt
     * @return the operation's result, or null on give-up without raising
     * @throws Exception the last trigger exception on give-up, or any other exception unchanged
     */
    public <T> T call(String target, Operation<? extends T> operation, Arguments arguments) throws Exception {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");

        ExceptionStateMachine<T> machine = newStateMachine(target, arguments);
        return BlockingRetryLoop.run(machine, operation, arguments, configuration.sleeper());
    }

    /**
     * Calls argument-less work, retrying as configured.
     */
    public <T> T call(String target, ThrowingSupplier<? extends T, ? extends Exception> work) throws Exception {
        return call(target, Operation.of(work), Arguments.empty());
    }

    /**
     * Calls an asynchronous operation, retrying as configured without blocking.
     *
     * @return a future of the operation's result, failed with the same exception
     *         {@link #call} would throw
     */
    public <T> CompletableFuture<T> callAsync(String target, AsyncOperation<? extends T> operation,
                                              Arguments arguments) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");

        ExceptionStateMachine<T> machine;
        try {
            machine = newStateMachine(target, arguments);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return new AsyncRetryLoop<>(machine, operation, arguments, configuration.delayer()).start();
    }

    /**
     * Binds an operation to this retrier.
     */
    public <T> RetryingOperation<T> bind(String target, Operation<? extends T> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        return new RetryingOperation<T>(target, arguments -> call(target, operation, arguments));
    }

    /**
     * Binds an asynchronous operation to this retrier.
     */
    public <T> AsyncRetryingOperation<T> bindAsync(String target, AsyncOperation<? extends T> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        return new AsyncRetryingOperation<T>(target, arguments -> callAsync(target, operation, arguments));
    }

    private <T> ExceptionStateMachine<T> newStateMachine(String target, Arguments arguments) {
        return new ExceptionStateMachine<>(configuration, target, arguments, triggers, giveup, raiseOnGiveup);
    }

    /**
     * Builder for {@link ExceptionRetrier}.
     */
    public static final class Builder extends RetryConfiguration.Builder<Builder> {
        private final List<Class<? extends Exception>> triggers;
        private Predicate<? super Exception> giveup = e -> false;
        private boolean raiseOnGiveup = true;

        private Builder(WaitGenerator waitGenerator, Collection<Class<? extends Exception>> triggers) {
            super(waitGenerator);
            Objects.requireNonNull(triggers, "triggers must not be null");
            if (triggers.isEmpty()) {
                throw new IllegalArgumentException("at least one trigger exception type is required");
            }
            for (Class<? extends Exception> trigger : triggers) {
                Objects.requireNonNull(trigger, "triggers must not contain null");
            }
            this.triggers = List.copyOf(triggers);
        }

        @Override
        protected Builder self() {
            return this;
        }

        /**
         * Gives up early when the predicate accepts a trigger exception (optional, defaults to never).
         *
         * @param giveup test of the caught exception
         * @return this builder
         */
        public Builder giveup(Predicate<? super Exception> giveup) {
            this.giveup = Objects.requireNonNull(giveup, "giveup must not be null");
            return this;
        }

        /**
         * Whether giving up rethrows the last exception (the default) or returns null.
         *
         * @param raiseOnGiveup false to return null on give-up
         * @return this builder
         */
        public Builder raiseOnGiveup(boolean raiseOnGiveup) {
            this.raiseOnGiveup = raiseOnGiveup;
            return this;
        }

        public ExceptionRetrier build() {
            return new ExceptionRetrier(this);
        }
    }
}
