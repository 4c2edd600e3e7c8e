package org.javai.backoff.retry;

import org.javai.backoff.Arguments;
import org.javai.backoff.Operation;

/**
 * Drives a {@link RetryStateMachine} on the calling thread, sleeping between attempts.
 */
final class BlockingRetryLoop {

    private BlockingRetryLoop() {}

    static <T> T run(RetryStateMachine<T> machine, Operation<? extends T> operation,
                     Arguments arguments, Sleeper sleeper) throws Exception {
        while (true) {
            machine.beforeAttempt();

            T result = null;
            Exception failure = null;
            try {
                result = operation.invoke(arguments);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                failure = e;
            }

            RetryDecision<T> decision = failure == null
                    ? machine.onResult(result)
                    : machine.onException(failure);

            if (decision instanceof RetryDecision.Complete<T> complete) {
                return complete.value();
            }
            if (decision instanceof RetryDecision.Raise<T> raise) {
                throw raise.exception();
            }
            RetryDecision.Backoff<T> backoff = (RetryDecision.Backoff<T>) decision;
            sleeper.sleep(backoff.delay());
        }
    }
}
