package org.javai.backoff.retry;

import org.javai.backoff.Arguments;
import org.javai.backoff.observe.Details;
import org.javai.backoff.observe.RetryEvent;
import org.javai.backoff.wait.WaitSequence;
import org.javai.backoff.wait.WaitSequenceExhaustedException;

import java.util.OptionalDouble;

/**
 * The state of one call of a retried operation.
 *
 * <p>Drivers call {@link #beforeAttempt()}, run the attempt, then hand its outcome to
 * {@link #onResult} or {@link #onException} and act on the returned decision. The machine
 * notifies observers itself, so blocking and asynchronous drivers fire identical events.
 * A machine is confined to one call and is never shared.
 *
 * @param <T> The type of result
 */
abstract class RetryStateMachine<T> {

    private final RetryConfiguration configuration;
    private final String target;
    private final Arguments arguments;
    private final Long maxTries;
    private final Double maxTime;
    private final long startNanos;
    private final WaitSequence waits;
    private int tries;

    RetryStateMachine(RetryConfiguration configuration, String target, Arguments arguments) {
        this.configuration = configuration;
        this.target = target;
        this.arguments = arguments;
        this.maxTries = configuration.resolveMaxTries();  // null means unbounded
        this.maxTime = configuration.resolveMaxTime();  // null means unbounded
        this.startNanos = configuration.ticker().nanoTime();
        this.waits = configuration.waitGenerator().start();
    }

    /**
     * Notifies the try observers.
     */
    final void beforeAttempt() {
        notify(RetryEvent.TRY, elapsed(), null, null, null);
    }

    /**
     * Evaluates an attempt that returned normally.
     */
    abstract RetryDecision<T> onResult(T result);

    /**
     * Evaluates an attempt that threw.
     */
    abstract RetryDecision<T> onException(Exception exception);

    /**
     * Counts a completed attempt.
     *
     * @return seconds elapsed since the first attempt
     */
    final double attemptCompleted() {
        double elapsed = elapsed();
        tries++;
        return elapsed;
    }

    final boolean budgetSpent(double elapsed) {
        boolean maxTriesReached = maxTries != null && tries >= maxTries;
        boolean maxTimeReached = maxTime != null && elapsed >= maxTime;
        return maxTriesReached || maxTimeReached;
    }

    /**
     * Computes the next wait, or empty if the wait sequence is exhausted.
     */
    final OptionalDouble nextWait(Object outcome, double elapsed) {
        try {
            return OptionalDouble.of(
                    WaitAccounting.nextWait(waits, outcome, configuration.jitter(), elapsed, maxTime));
        } catch (WaitSequenceExhaustedException e) {
            return OptionalDouble.empty();
        }
    }

    final void notify(RetryEvent event, double elapsed, Double wait, Object value, Exception exception) {
        Details details = new Details(target, arguments, tries, elapsed, wait, value, exception);
        configuration.observers().notify(event, details);
    }

    private double elapsed() {
        return (configuration.ticker().nanoTime() - startNanos) / 1_000_000_000d;
    }
}
