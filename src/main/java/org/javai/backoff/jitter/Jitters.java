package org.javai.backoff.jitter;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Standard jitter functions. All draw from {@link ThreadLocalRandom}, so they may be shared
 * freely between threads and retriers.
 */
public final class Jitters {

    private static final JitterFunction NONE = JitterFunction.of(value -> value);
    private static final JitterFunction RANDOM =
            JitterFunction.of(value -> value + ThreadLocalRandom.current().nextDouble());
    private static final JitterFunction FULL =
            JitterFunction.of(value -> value * ThreadLocalRandom.current().nextDouble());
    private static final JitterFunction EQUAL =
            JitterFunction.of(value -> value / 2 + value / 2 * ThreadLocalRandom.current().nextDouble());

    private Jitters() {}

    /**
     * Passes the raw wait through unchanged.
     */
    public static JitterFunction none() {
        return NONE;
    }

    /**
     * Adds up to one second to the raw wait.
     */
    public static JitterFunction random() {
        return RANDOM;
    }

    /**
     * Picks uniformly between zero and the raw wait. The default for every retrier.
     */
    public static JitterFunction full() {
        return FULL;
    }

    /**
     * Keeps half of the raw wait and randomizes the other half.
     */
    public static JitterFunction equal() {
        return EQUAL;
    }
}
