package org.javai.backoff.wait;

/**
 * A lazy sequence of wait durations in seconds, started fresh for each call of a retried operation.
 *
 * <p>Implementations are not thread-safe; a sequence belongs to exactly one retry loop.
 */
public interface WaitSequence {

    /**
     * Pulls the next wait duration.
     *
     * @param outcome the result returned or the exception thrown by the attempt that
     *                just completed; only feedback-driven sequences consult it
     * @return the next non-negative duration in seconds
     * @throws WaitSequenceExhaustedException if the sequence has no more values
     */
    double next(Object outcome);
}
