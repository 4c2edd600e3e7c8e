package org.javai.backoff.wait;

import java.util.function.ToDoubleFunction;

/**
 * Shortcuts for the standard wait generators.
 *
 * <p>Use the builders on each generator type for parameters computed at call time.
 */
public final class WaitGenerators {

    private WaitGenerators() {}

    /** Exponential wait 1, 2, 4, 8, ... without a ceiling. */
    public static WaitGenerator expo() {
        return ExponentialWait.builder().build();
    }

    public static WaitGenerator expo(double base, double factor, double maxValue) {
        return ExponentialWait.builder()
                .base(base)
                .factor(factor)
                .maxValue(maxValue)
                .build();
    }

    /** Fibonacci wait 1, 1, 2, 3, 5, ... without a ceiling. */
    public static WaitGenerator fibo() {
        return FibonacciWait.unbounded();
    }

    public static WaitGenerator fibo(double maxValue) {
        return FibonacciWait.withMaxValue(maxValue);
    }

    public static WaitGenerator constant(double interval) {
        return ConstantWait.of(interval);
    }

    /**
     * Waits each of {@code intervals} once, then gives up.
     */
    public static WaitGenerator constant(double first, double... rest) {
        double[] all = new double[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return ConstantWait.sequence(all);
    }

    /** Decay wait 1, e^-1, e^-2, ... without a floor. */
    public static WaitGenerator decay() {
        return DecayWait.builder().build();
    }

    public static WaitGenerator decay(double initialValue, double decayFactor, double minValue) {
        return DecayWait.builder()
                .initialValue(initialValue)
                .decayFactor(decayFactor)
                .minValue(minValue)
                .build();
    }

    public static WaitGenerator runtime(ToDoubleFunction<Object> mapping) {
        return RuntimeWait.of(mapping);
    }
}
