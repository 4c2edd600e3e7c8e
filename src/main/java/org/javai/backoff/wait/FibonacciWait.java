package org.javai.backoff.wait;

import org.javai.backoff.ConfigValue;

import java.util.function.Supplier;

/**
 * Fibonacci wait: 1, 1, 2, 3, 5, 8, ... clamped to {@code maxValue} once reached.
 */
public final class FibonacciWait implements WaitGenerator {

    private final ConfigValue<? extends Number> maxValue;

    private FibonacciWait(ConfigValue<? extends Number> maxValue) {
        this.maxValue = maxValue;  // null means unbounded
    }

    public static FibonacciWait unbounded() {
        return new FibonacciWait(null);
    }

    public static FibonacciWait withMaxValue(double maxValue) {
        Parameters.requireNonNegativeLiteral("maxValue", maxValue);
        return new FibonacciWait(ConfigValue.of(maxValue));
    }

    public static FibonacciWait withMaxValue(Supplier<? extends Number> maxValue) {
        return new FibonacciWait(Parameters.resolver("maxValue", maxValue));
    }

    @Override
    public WaitSequence start() {
        Double resolvedMax = Parameters.optionalNonNegative("maxValue", maxValue);
        return new WaitSequence() {
            private double a = 1;
            private double b = 1;

            @Override
            public double next(Object outcome) {
                if (resolvedMax == null || a < resolvedMax) {
                    double term = a;
                    a = b;
                    b = term + b;
                    return term;
                }
                return resolvedMax;
            }
        };
    }
}
