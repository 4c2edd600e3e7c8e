package org.javai.backoff.retry;

import org.javai.backoff.ConfigValue;
import org.javai.backoff.jitter.JitterFunction;
import org.javai.backoff.jitter.Jitters;
import org.javai.backoff.observe.Observers;
import org.javai.backoff.observe.RetryLogging;
import org.javai.backoff.observe.RetryObserver;
import org.javai.backoff.wait.WaitGenerator;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * The settings shared by both kinds of retrier. Immutable once built.
 */
public final class RetryConfiguration {

    private final WaitGenerator waitGenerator;
    private final ConfigValue<? extends Number> maxTries;
    private final ConfigValue<? extends Number> maxTime;
    private final JitterFunction jitter;
    private final Observers observers;
    private final Sleeper sleeper;
    private final Delayer delayer;
    private final Ticker ticker;

    private RetryConfiguration(Builder<?> builder) {
        this.waitGenerator = builder.waitGenerator;
        this.maxTries = builder.maxTries;  // null means unbounded
        this.maxTime = builder.maxTime;  // null means unbounded
        this.jitter = builder.jitter;  // null means no jitter
        this.observers = new Observers(
                builder.onTry,
                builder.onBackoff != null ? builder.onBackoff : builder.logging.defaultBackoffObservers(),
                builder.onGiveup != null ? builder.onGiveup : builder.logging.defaultGiveupObservers(),
                builder.onSuccess);
        this.sleeper = builder.sleeper;
        this.delayer = builder.delayer;
        this.ticker = builder.ticker;
    }

    public WaitGenerator waitGenerator() {
        return waitGenerator;
    }

    public JitterFunction jitter() {
        return jitter;
    }

    public Observers observers() {
        return observers;
    }

    Sleeper sleeper() {
        return sleeper;
    }

    Delayer delayer() {
        return delayer;
    }

    Ticker ticker() {
        return ticker;
    }

    /**
     * Resolves the try limit for one call.
     *
     * @return the limit, or null if unbounded
     * @throws IllegalArgumentException if the resolved limit is not a whole number of at least 1
     */
    Long resolveMaxTries() {
        Number resolved = maxTries == null ? null : maxTries.resolve();
        if (resolved == null) {
            return null;
        }
        double asDouble = resolved.doubleValue();
        if (Double.isNaN(asDouble) || Double.isInfinite(asDouble) || asDouble != Math.rint(asDouble)) {
            throw new IllegalArgumentException("maxTries must be a whole number, was: " + resolved);
        }
        if (asDouble < 1) {
            throw new IllegalArgumentException("maxTries must be >= 1, was: " + resolved);
        }
        // whole values beyond the long range saturate
        return asDouble >= Long.MAX_VALUE ? Long.MAX_VALUE : resolved.longValue();
    }

    /**
     * Resolves the time budget, in seconds, for one call.
     *
     * @return the budget, or null if unbounded
     * @throws IllegalArgumentException if the resolved budget is negative
     */
    Double resolveMaxTime() {
        Number resolved = maxTime == null ? null : maxTime.resolve();
        if (resolved == null) {
            return null;
        }
        double value = resolved.doubleValue();
        if (Double.isNaN(value) || value < 0) {
            throw new IllegalArgumentException("maxTime must be >= 0, was: " + value);
        }
        return value;
    }

    /**
     * Settings common to predicate- and exception-triggered retriers.
     *
     * @param <B> the concrete builder type
     */
    public abstract static class Builder<B extends Builder<B>> {
        private final WaitGenerator waitGenerator;
        private ConfigValue<? extends Number> maxTries;
        private ConfigValue<? extends Number> maxTime;
        private JitterFunction jitter = Jitters.full();
        private List<RetryObserver> onTry = List.of();
        private List<RetryObserver> onBackoff;
        private List<RetryObserver> onGiveup;
        private List<RetryObserver> onSuccess = List.of();
        private RetryLogging logging = RetryLogging.defaults();
        private Sleeper sleeper = Sleeper.threadSleeper();
        private Delayer delayer = Delayer.defaultDelayer();
        private Ticker ticker = Ticker.system();

        protected Builder(WaitGenerator waitGenerator) {
            this.waitGenerator = Objects.requireNonNull(waitGenerator, "waitGenerator must not be null");
        }

        protected abstract B self();

        /**
         * Gives up once this many attempts have been made (optional, defaults to unlimited).
         *
         * @param maxTries maximum number of attempts (must be > 0)
         * @return this builder
         */
        public B maxTries(int maxTries) {
            if (maxTries < 1) {
                throw new IllegalArgumentException("maxTries must be >= 1, was: " + maxTries);
            }
            this.maxTries = ConfigValue.of(maxTries);
            return self();
        }

        /**
         * Sets a try limit resolved at the start of every call. A null result means unlimited.
         *
         * @param maxTries supplier of the limit
         * @return this builder
         */
        public B maxTries(Supplier<? extends Number> maxTries) {
            Objects.requireNonNull(maxTries, "maxTries must not be null");
            this.maxTries = ConfigValue.resolvedBy(maxTries);
            return self();
        }

        /**
         * Gives up once this many seconds have passed since the first attempt
         * (optional, defaults to unlimited).
         *
         * @param seconds time budget in seconds (must be >= 0)
         * @return this builder
         */
        public B maxTime(double seconds) {
            if (Double.isNaN(seconds) || seconds < 0) {
                throw new IllegalArgumentException("maxTime must be >= 0, was: " + seconds);
            }
            this.maxTime = ConfigValue.of(seconds);
            return self();
        }

        public B maxTime(Duration budget) {
            Objects.requireNonNull(budget, "budget must not be null");
            return maxTime(budget.toNanos() / 1_000_000_000d);
        }

        /**
         * Sets a time budget in seconds, resolved at the start of every call. A null result means unlimited.
         *
         * @param seconds supplier of the budget
         * @return this builder
         */
        public B maxTime(Supplier<? extends Number> seconds) {
            Objects.requireNonNull(seconds, "seconds must not be null");
            this.maxTime = ConfigValue.resolvedBy(seconds);
            return self();
        }

        /**
         * Sets the jitter applied to every wait (defaults to {@link Jitters#full()}).
         *
         * @param jitter the jitter function, or null to sleep the raw waits
         * @return this builder
         */
        public B jitter(JitterFunction jitter) {
            this.jitter = jitter;
            return self();
        }

        /**
         * Replaces the observers called before each attempt.
         */
        public B onTry(RetryObserver... observers) {
            this.onTry = list("onTry", observers);
            return self();
        }

        public B onTry(Collection<? extends RetryObserver> observers) {
            this.onTry = list("onTry", observers);
            return self();
        }

        /**
         * Replaces the observers called before each sleep. Setting any list, even an
         * empty one, turns off the default logging observer.
         */
        public B onBackoff(RetryObserver... observers) {
            this.onBackoff = list("onBackoff", observers);
            return self();
        }

        public B onBackoff(Collection<? extends RetryObserver> observers) {
            this.onBackoff = list("onBackoff", observers);
            return self();
        }

        /**
         * Replaces the observers called on give-up. Setting any list, even an
         * empty one, turns off the default logging observer.
         */
        public B onGiveup(RetryObserver... observers) {
            this.onGiveup = list("onGiveup", observers);
            return self();
        }

        public B onGiveup(Collection<? extends RetryObserver> observers) {
            this.onGiveup = list("onGiveup", observers);
            return self();
        }

        /**
         * Replaces the observers called on success.
         */
        public B onSuccess(RetryObserver... observers) {
            this.onSuccess = list("onSuccess", observers);
            return self();
        }

        public B onSuccess(Collection<? extends RetryObserver> observers) {
            this.onSuccess = list("onSuccess", observers);
            return self();
        }

        /**
         * Configures the default backoff and give-up logging (defaults to {@link RetryLogging#defaults()}).
         *
         * @param logging logger and levels, or {@link RetryLogging#disabled()}
         * @return this builder
         */
        public B logging(RetryLogging logging) {
            this.logging = Objects.requireNonNull(logging, "logging must not be null");
            return self();
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        B sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return self();
        }

        /**
         * Sets the delayer for testing (package-private).
         */
        B delayer(Delayer delayer) {
            this.delayer = Objects.requireNonNull(delayer, "delayer must not be null");
            return self();
        }

        /**
         * Sets the ticker for testing (package-private).
         */
        B ticker(Ticker ticker) {
            this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
            return self();
        }

        protected RetryConfiguration configuration() {
            return new RetryConfiguration(this);
        }

        private static List<RetryObserver> list(String name, RetryObserver[] observers) {
            Objects.requireNonNull(observers, name + " must not be null");
            return list(name, Arrays.asList(observers));
        }

        private static List<RetryObserver> list(String name, Collection<? extends RetryObserver> observers) {
            Objects.requireNonNull(observers, name + " must not be null");
            for (RetryObserver observer : observers) {
                Objects.requireNonNull(observer, name + " must not contain null observers");
            }
            return List.copyOf(observers);
        }
    }
}
