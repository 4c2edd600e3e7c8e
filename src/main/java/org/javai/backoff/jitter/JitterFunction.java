package org.javai.backoff.jitter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;
import java.util.function.DoubleUnaryOperator;

/**
 * Randomizes a raw wait so that clients backing off together do not retry in lockstep.
 *
 * <p>Instances hold no mutable state; any randomness comes from the supplied function.
 * A jittered wait is never negative.
 */
public final class JitterFunction {

    private static final Logger LOGGER = LogManager.getLogger(JitterFunction.class);
    private static final AtomicBoolean DELTA_NOTICE_LOGGED = new AtomicBoolean();

    private final JitterMode mode;
    private final DoubleUnaryOperator transform;
    private final DoubleSupplier delta;

    private JitterFunction(JitterMode mode, DoubleUnaryOperator transform, DoubleSupplier delta) {
        this.mode = mode;
        this.transform = transform;
        this.delta = delta;
    }

    /**
     * Creates a jitter function that maps the raw wait to the wait to sleep.
     *
     * @param transform function of the raw wait in seconds
     * @return a {@link JitterMode#TRANSFORM} jitter function
     */
    public static JitterFunction of(DoubleUnaryOperator transform) {
        Objects.requireNonNull(transform, "transform must not be null");
        return new JitterFunction(JitterMode.TRANSFORM, transform, null);
    }

    /**
     * Creates a jitter function whose result is added to the raw wait.
     *
     * @param delta supplier of the offset in seconds
     * @return a {@link JitterMode#DELTA} jitter function
     * @deprecated offsets ignore the raw wait; use {@link #of(DoubleUnaryOperator)}
     */
    @Deprecated
    public static JitterFunction delta(DoubleSupplier delta) {
        Objects.requireNonNull(delta, "delta must not be null");
        return new JitterFunction(JitterMode.DELTA, null, delta);
    }

    public JitterMode mode() {
        return mode;
    }

    /**
     * Jitters a raw wait.
     *
     * @param seconds the raw wait in seconds
     * @return the wait to sleep, in seconds, never negative
     */
    @SuppressWarnings("deprecation")
    public double apply(double seconds) {
        double jittered;
        if (mode == JitterMode.DELTA) {
            if (DELTA_NOTICE_LOGGED.compareAndSet(false, true)) {
                LOGGER.warn("Offset jitter functions are deprecated. Use JitterFunction.of with a "
                        + "function of the raw wait returning the jittered wait.");
            }
            jittered = seconds + delta.getAsDouble();
        } else {
            jittered = transform.applyAsDouble(seconds);
        }
        return Math.max(0, jittered);
    }
}
