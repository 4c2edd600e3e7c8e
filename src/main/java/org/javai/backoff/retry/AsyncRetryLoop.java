package org.javai.backoff.retry;

import org.javai.backoff.Arguments;
import org.javai.backoff.AsyncOperation;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives a {@link RetryStateMachine} by composing futures: no thread is blocked while an
 * attempt is in flight or while waiting to retry.
 *
 * <p>Cancelling the returned future cancels whatever is pending, the attempt or the delay.
 * An attempt or delay that ends in cancellation cancels the returned future. Neither case
 * notifies backoff or give-up observers.
 */
final class AsyncRetryLoop<T> {

    private final RetryStateMachine<T> machine;
    private final AsyncOperation<? extends T> operation;
    private final Arguments arguments;
    private final Delayer delayer;
    private final CompletableFuture<T> result = new CompletableFuture<>();
    private final AtomicReference<CompletableFuture<?>> pending = new AtomicReference<>();

    AsyncRetryLoop(RetryStateMachine<T> machine, AsyncOperation<? extends T> operation,
                   Arguments arguments, Delayer delayer) {
        this.machine = machine;
        this.operation = operation;
        this.arguments = arguments;
        this.delayer = delayer;
    }

    CompletableFuture<T> start() {
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                CompletableFuture<?> inFlight = pending.get();
                if (inFlight != null) {
                    inFlight.cancel(true);
                }
            }
        });
        attempt();
        return result;
    }

    private void attempt() {
        if (result.isDone()) {
            return;
        }
        try {
            machine.beforeAttempt();
        } catch (RuntimeException | Error e) {
            result.completeExceptionally(e);
            return;
        }

        CompletableFuture<? extends T> attempt;
        try {
            attempt = operation.invoke(arguments);
            if (attempt == null) {
                attempt = CompletableFuture.failedFuture(
                        new NullPointerException("operation returned a null future"));
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            attempt = CompletableFuture.failedFuture(e);
        }
        track(attempt);
        attempt.whenComplete((value, error) -> attemptCompleted(value, error));
    }

    private void attemptCompleted(T value, Throwable error) {
        if (result.isDone()) {
            return;
        }
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException) {
            result.cancel(false);
            return;
        }
        if (cause != null && !(cause instanceof Exception)) {
            result.completeExceptionally(cause);
            return;
        }

        RetryDecision<T> decision;
        try {
            decision = cause == null
                    ? machine.onResult(value)
                    : machine.onException((Exception) cause);
        } catch (RuntimeException | Error e) {
            result.completeExceptionally(e);
            return;
        }

        if (decision instanceof RetryDecision.Complete<T> complete) {
            result.complete(complete.value());
        } else if (decision instanceof RetryDecision.Raise<T> raise) {
            result.completeExceptionally(raise.exception());
        } else {
            RetryDecision.Backoff<T> backoff = (RetryDecision.Backoff<T>) decision;
            CompletableFuture<Void> delay = delayer.delay(backoff.delay());
            track(delay);
            delay.whenComplete((ignored, delayError) -> delayCompleted(delayError));
        }
    }

    private void delayCompleted(Throwable error) {
        if (error == null) {
            attempt();
            return;
        }
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException) {
            result.cancel(false);
        } else {
            result.completeExceptionally(cause);
        }
    }

    private void track(CompletableFuture<?> future) {
        pending.set(future);
        if (result.isCancelled()) {
            future.cancel(true);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
