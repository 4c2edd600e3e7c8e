package org.javai.backoff.wait;

import org.javai.backoff.ConfigValue;

import java.util.function.Supplier;

/**
 * Exponential wait: {@code factor * base^n} for n = 0, 1, 2, ...
 *
 * <p>Once a term reaches or exceeds {@code maxValue}, exactly {@code maxValue} is yielded
 * for that pull and every later one.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * WaitGenerator waits = ExponentialWait.builder()
 *     .base(2)
 *     .factor(0.5)
 *     .maxValue(settings::maxBackoffSeconds)
 *     .build();
 * }</pre>
 */
public final class ExponentialWait implements WaitGenerator {

    private final ConfigValue<? extends Number> base;
    private final ConfigValue<? extends Number> factor;
    private final ConfigValue<? extends Number> maxValue;

    private ExponentialWait(Builder builder) {
        this.base = builder.base;
        this.factor = builder.factor;
        this.maxValue = builder.maxValue;  // null means unbounded
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public WaitSequence start() {
        double resolvedBase = Parameters.positive("base", base);
        double resolvedFactor = Parameters.nonNegative("factor", factor);
        Double resolvedMax = Parameters.optionalNonNegative("maxValue", maxValue);
        return new Sequence(resolvedBase, resolvedFactor, resolvedMax);
    }

    private static final class Sequence implements WaitSequence {
        private final double base;
        private final double factor;
        private final Double maxValue;
        private int n;

        Sequence(double base, double factor, Double maxValue) {
            this.base = base;
            this.factor = factor;
            this.maxValue = maxValue;
        }

        @Override
        public double next(Object outcome) {
            double term = factor * Math.pow(base, n);
            if (maxValue == null || term < maxValue) {
                n++;
                return term;
            }
            return maxValue;
        }
    }

    /**
     * Builder for {@link ExponentialWait}. Defaults: base 2, factor 1, no maximum.
     */
    public static final class Builder {
        private ConfigValue<? extends Number> base = ConfigValue.of(2);
        private ConfigValue<? extends Number> factor = ConfigValue.of(1);
        private ConfigValue<? extends Number> maxValue;

        private Builder() {}

        public Builder base(double base) {
            if (!(base > 0)) {
                throw new IllegalArgumentException("base must be > 0, was: " + base);
            }
            this.base = ConfigValue.of(base);
            return this;
        }

        public Builder base(Supplier<? extends Number> base) {
            this.base = Parameters.resolver("base", base);
            return this;
        }

        public Builder factor(double factor) {
            Parameters.requireNonNegativeLiteral("factor", factor);
            this.factor = ConfigValue.of(factor);
            return this;
        }

        public Builder factor(Supplier<? extends Number> factor) {
            this.factor = Parameters.resolver("factor", factor);
            return this;
        }

        /**
         * Sets the ceiling, in seconds, of the yielded values.
         */
        public Builder maxValue(double maxValue) {
            Parameters.requireNonNegativeLiteral("maxValue", maxValue);
            this.maxValue = ConfigValue.of(maxValue);
            return this;
        }

        /**
         * Sets a ceiling computed when each sequence starts. A null result means no ceiling.
         */
        public Builder maxValue(Supplier<? extends Number> maxValue) {
            this.maxValue = Parameters.resolver("maxValue", maxValue);
            return this;
        }

        public ExponentialWait build() {
            return new ExponentialWait(this);
        }
    }
}
