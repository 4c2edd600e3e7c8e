package org.javai.backoff.retry;

import org.javai.backoff.Arguments;
import org.javai.backoff.observe.RetryEvent;

import java.util.OptionalDouble;
import java.util.function.Predicate;

/**
 * Retries while the result satisfies the retry predicate. Giving up returns the last result;
 * exceptions thrown by the operation are never retried.
 */
final class PredicateStateMachine<T> extends RetryStateMachine<T> {

    private final Predicate<? super T> retryWhile;

    PredicateStateMachine(RetryConfiguration configuration, String target, Arguments arguments,
                          Predicate<? super T> retryWhile) {
        super(configuration, target, arguments);
        this.retryWhile = retryWhile;
    }

    @Override
    RetryDecision<T> onResult(T result) {
        double elapsed = attemptCompleted();

        if (!retryWhile.test(result)) {
            notify(RetryEvent.SUCCESS, elapsed, null, result, null);
            return new RetryDecision.Complete<>(result);
        }

        if (budgetSpent(elapsed)) {
            notify(RetryEvent.GIVEUP, elapsed, null, result, null);
            return new RetryDecision.Complete<>(result);
        }

        OptionalDouble wait = nextWait(result, elapsed);
        if (wait.isEmpty()) {
            notify(RetryEvent.GIVEUP, elapsed, null, result, null);
            return new RetryDecision.Complete<>(result);
        }

        notify(RetryEvent.BACKOFF, elapsed, wait.getAsDouble(), result, null);
        return new RetryDecision.Backoff<>(wait.getAsDouble());
    }

    @Override
    RetryDecision<T> onException(Exception exception) {
        return new RetryDecision.Raise<>(exception);
    }
}
