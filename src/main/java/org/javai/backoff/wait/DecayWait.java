package org.javai.backoff.wait;

import org.javai.backoff.ConfigValue;

import java.util.function.Supplier;

/**
 * Exponential decay: {@code initialValue * e^(-t * decayFactor)} for t = 0, 1, 2, ...
 *
 * <p>Once a term is at or below {@code minValue}, exactly {@code minValue} is yielded from
 * then on. Useful for polling that should speed up the longer it runs.
 */
public final class DecayWait implements WaitGenerator {

    private final ConfigValue<? extends Number> initialValue;
    private final ConfigValue<? extends Number> decayFactor;
    private final ConfigValue<? extends Number> minValue;

    private DecayWait(Builder builder) {
        this.initialValue = builder.initialValue;
        this.decayFactor = builder.decayFactor;
        this.minValue = builder.minValue;  // null means no floor
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public WaitSequence start() {
        double initial = Parameters.nonNegative("initialValue", initialValue);
        double decay = Parameters.required("decayFactor", decayFactor);
        Double floor = Parameters.optionalNonNegative("minValue", minValue);
        return new WaitSequence() {
            private int t;

            @Override
            public double next(Object outcome) {
                double term = initial * Math.exp(-t * decay);
                if (floor == null || term > floor) {
                    t++;
                    return term;
                }
                return floor;
            }
        };
    }

    /**
     * Builder for {@link DecayWait}. Defaults: initial value 1, decay factor 1, no floor.
     */
    public static final class Builder {
        private ConfigValue<? extends Number> initialValue = ConfigValue.of(1);
        private ConfigValue<? extends Number> decayFactor = ConfigValue.of(1);
        private ConfigValue<? extends Number> minValue;

        private Builder() {}

        public Builder initialValue(double initialValue) {
            Parameters.requireNonNegativeLiteral("initialValue", initialValue);
            this.initialValue = ConfigValue.of(initialValue);
            return this;
        }

        public Builder initialValue(Supplier<? extends Number> initialValue) {
            this.initialValue = Parameters.resolver("initialValue", initialValue);
            return this;
        }

        public Builder decayFactor(double decayFactor) {
            if (Double.isNaN(decayFactor)) {
                throw new IllegalArgumentException("decayFactor must be a number, was: NaN");
            }
            this.decayFactor = ConfigValue.of(decayFactor);
            return this;
        }

        public Builder decayFactor(Supplier<? extends Number> decayFactor) {
            this.decayFactor = Parameters.resolver("decayFactor", decayFactor);
            return this;
        }

        public Builder minValue(double minValue) {
            Parameters.requireNonNegativeLiteral("minValue", minValue);
            this.minValue = ConfigValue.of(minValue);
            return this;
        }

        public Builder minValue(Supplier<? extends Number> minValue) {
            this.minValue = Parameters.resolver("minValue", minValue);
            return this;
        }

        public DecayWait build() {
            return new DecayWait(this);
        }
    }
}
