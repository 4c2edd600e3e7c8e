package org.javai.backoff.retry;

import org.javai.backoff.jitter.JitterFunction;
import org.javai.backoff.wait.WaitSequence;
import org.javai.backoff.wait.WaitSequenceExhaustedException;

/**
 * Turns the next value of a wait sequence into the number of seconds to actually sleep.
 */
public final class WaitAccounting {

    private WaitAccounting() {}

    /**
     * Computes the next wait.
     *
     * @param sequence the call's wait sequence
     * @param lastOutcome result or exception of the attempt that just completed
     * @param jitter jitter to apply, or null for none
     * @param elapsed seconds since the first attempt
     * @param maxTime time budget in seconds, or null for none
     * @return seconds to sleep; never more than the remaining budget and never negative
     * @throws WaitSequenceExhaustedException if the sequence has no more values
     */
    public static double nextWait(WaitSequence sequence, Object lastOutcome, JitterFunction jitter,
                                  double elapsed, Double maxTime) {
        double value = sequence.next(lastOutcome);
        if (maxTime != null && elapsed >= maxTime) {
            return 0;
        }

        double seconds = jitter == null ? value : jitter.apply(value);

        // don't sleep past the time budget
        if (maxTime != null) {
            seconds = Math.min(seconds, maxTime - elapsed);
        }
        return Math.max(0, seconds);
    }
}
