package org.javai.backoff;

import org.javai.backoff.retry.ExceptionRetrier;
import org.javai.backoff.retry.PredicateRetrier;
import org.javai.backoff.wait.WaitGenerator;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Entry points for building retriers.
 *
 * <p>Retry on exception:</p>
 * <pre>{@code
 * ExceptionRetrier retrier = Backoff.onException(WaitGenerators.expo(), IOException.class, TimeoutException.class)
 *     .maxTime(Duration.ofSeconds(60))
 *     .build();
 *
 * RetryingOperation<String> fetch = retrier.bind("fetch", args -> http.get((URI) args.get(0)));
 * String page = fetch.call(uri);
 * }</pre>
 *
 * <p>Retry on result (polling):</p>
 * <pre>{@code
 * PredicateRetrier<List<Message>> poller = Backoff.<List<Message>>onPredicate(WaitGenerators.constant(1))
 *     .maxTries(10)
 *     .jitter(null)
 *     .build();
 *
 * List<Message> messages = poller.call("poll", () -> queue.poll());
 * }</pre>
 */
public final class Backoff {

    private Backoff() {}

    /**
     * Starts a retrier that calls again while the result is falsy.
     *
     * @param waitGenerator the wait schedule between attempts
     * @return a builder
     */
    public static <T> PredicateRetrier.Builder<T> onPredicate(WaitGenerator waitGenerator) {
        return PredicateRetrier.builder(waitGenerator);
    }

    /**
     * Starts a retrier that calls again while {@code predicate} accepts the result.
     *
     * @param waitGenerator the wait schedule between attempts
     * @param predicate test of the latest result; true means try again
     * @return a builder
     */
    public static <T> PredicateRetrier.Builder<T> onPredicate(WaitGenerator waitGenerator,
                                                              Predicate<? super T> predicate) {
        return PredicateRetrier.<T>builder(waitGenerator).predicate(predicate);
    }

    /**
     * Starts a retrier that calls again while the operation throws one of {@code triggers}.
     *
     * @param waitGenerator the wait schedule between attempts
     * @param triggers the exception types that cause a retry (at least one)
     * @return a builder
     */
    @SafeVarargs
    public static ExceptionRetrier.Builder onException(WaitGenerator waitGenerator,
                                                       Class<? extends Exception>... triggers) {
        Objects.requireNonNull(triggers, "triggers must not be null");
        return ExceptionRetrier.builder(waitGenerator, Arrays.asList(triggers));
    }
}
