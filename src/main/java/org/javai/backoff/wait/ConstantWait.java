package org.javai.backoff.wait;

import org.javai.backoff.ConfigValue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Constant wait.
 *
 * <p>A single interval is repeated forever. A list of intervals is yielded once, in order,
 * after which the sequence is exhausted and the retry loop gives up.
 */
public final class ConstantWait implements WaitGenerator {

    private final ConfigValue<? extends Number> interval;
    private final ConfigValue<? extends List<? extends Number>> intervals;

    private ConstantWait(ConfigValue<? extends Number> interval,
                         ConfigValue<? extends List<? extends Number>> intervals) {
        this.interval = interval;
        this.intervals = intervals;
    }

    /**
     * Repeats {@code interval} seconds forever.
     */
    public static ConstantWait of(double interval) {
        Parameters.requireNonNegativeLiteral("interval", interval);
        return new ConstantWait(ConfigValue.of(interval), null);
    }

    /**
     * Repeats an interval computed when each sequence starts.
     */
    public static ConstantWait of(Supplier<? extends Number> interval) {
        return new ConstantWait(Parameters.resolver("interval", interval), null);
    }

    /**
     * Yields each interval once, in order, then signals exhaustion.
     */
    public static ConstantWait sequence(double... intervals) {
        Objects.requireNonNull(intervals, "intervals must not be null");
        List<Double> values = new ArrayList<>(intervals.length);
        for (double value : intervals) {
            Parameters.requireNonNegativeLiteral("interval", value);
            values.add(value);
        }
        return new ConstantWait(null, ConfigValue.of(List.copyOf(values)));
    }

    /**
     * Yields each interval of a list computed when each sequence starts, then signals exhaustion.
     */
    public static ConstantWait sequence(Supplier<? extends List<? extends Number>> intervals) {
        return new ConstantWait(null, Parameters.resolver("intervals", intervals));
    }

    @Override
    public WaitSequence start() {
        if (intervals == null) {
            double value = Parameters.nonNegative("interval", interval);
            return outcome -> value;
        }
        List<? extends Number> resolved = intervals.resolve();
        if (resolved == null) {
            throw new IllegalArgumentException("intervals must not resolve to null");
        }
        List<Double> values = new ArrayList<>(resolved.size());
        for (Number number : resolved) {
            values.add(Parameters.nonNegative("interval", ConfigValue.of(number)));
        }
        Iterator<Double> remaining = values.iterator();
        return outcome -> {
            if (!remaining.hasNext()) {
                throw new WaitSequenceExhaustedException(
                        "all " + values.size() + " constant intervals have been used");
            }
            return remaining.next();
        };
    }
}
