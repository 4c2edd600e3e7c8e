package org.javai.backoff.retry;

import org.javai.backoff.Arguments;
import org.javai.backoff.observe.RetryEvent;

import java.util.List;
import java.util.OptionalDouble;
import java.util.function.Predicate;

/**
 * Retries while the operation throws one of the trigger exception types.
 * Any other exception propagates on first occurrence.
 */
final class ExceptionStateMachine<T> extends RetryStateMachine<T> {

    private final List<Class<? extends Exception>> triggers;
    private final Predicate<? super Exception> giveup;
    private final boolean raiseOnGiveup;

    ExceptionStateMachine(RetryConfiguration configuration, String target, Arguments arguments,
                          List<Class<? extends Exception>> triggers,
                          Predicate<? super Exception> giveup,
                          boolean raiseOnGiveup) {
        super(configuration, target, arguments);
        this.triggers = triggers;
        this.giveup = giveup;
        this.raiseOnGiveup = raiseOnGiveup;
    }

    @Override
    RetryDecision<T> onResult(T result) {
        double elapsed = attemptCompleted();
        notify(RetryEvent.SUCCESS, elapsed, null, null, null);
        return new RetryDecision.Complete<>(result);
    }

    @Override
    RetryDecision<T> onException(Exception exception) {
        if (!isTrigger(exception)) {
            return new RetryDecision.Raise<>(exception);
        }
        double elapsed = attemptCompleted();

        if (giveup.test(exception) || budgetSpent(elapsed)) {
            notify(RetryEvent.GIVEUP, elapsed, null, null, exception);
            return raiseOnGiveup
                    ? new RetryDecision.Raise<>(exception)
                    : new RetryDecision.Complete<>(null);
        }

        OptionalDouble wait = nextWait(exception, elapsed);
        if (wait.isEmpty()) {
            notify(RetryEvent.GIVEUP, elapsed, null, null, exception);
            return new RetryDecision.Raise<>(exception);
        }

        notify(RetryEvent.BACKOFF, elapsed, wait.getAsDouble(), null, exception);
        return new RetryDecision.Backoff<>(wait.getAsDouble());
    }

    private boolean isTrigger(Exception exception) {
        if (exception instanceof InterruptedException) {
            return false;
        }
        for (Class<? extends Exception> trigger : triggers) {
            if (trigger.isInstance(exception)) {
                return true;
            }
        }
        return false;
    }
}
