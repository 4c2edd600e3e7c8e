package org.javai.backoff.wait;

/**
 * Creates wait sequences.
 *
 * <p>Generators are immutable and shared by every call of a retrier. Each call starts its
 * own sequence, so no sequence state is ever shared between calls.
 */
@FunctionalInterface
public interface WaitGenerator {

    /**
     * Starts a new sequence. Parameters given as suppliers are resolved here, once.
     *
     * @return a fresh wait sequence
     * @throws IllegalArgumentException if a resolved parameter is out of range
     */
    WaitSequence start();
}
