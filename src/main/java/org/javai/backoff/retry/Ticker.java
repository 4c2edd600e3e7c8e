package org.javai.backoff.retry;

/**
 * Monotonic time source for elapsed-time accounting.
 */
@FunctionalInterface
interface Ticker {

    long nanoTime();

    static Ticker system() {
        return System::nanoTime;
    }
}
