package org.javai.backoff.wait;

import org.javai.backoff.ConfigValue;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Resolution and range checks for wait generator parameters.
 */
final class Parameters {

    private Parameters() {}

    static double required(String name, ConfigValue<? extends Number> value) {
        Number resolved = value.resolve();
        if (resolved == null) {
            throw new IllegalArgumentException(name + " must not resolve to null");
        }
        double number = resolved.doubleValue();
        if (Double.isNaN(number)) {
            throw new IllegalArgumentException(name + " must be a number, was: NaN");
        }
        return number;
    }

    static double nonNegative(String name, ConfigValue<? extends Number> value) {
        double number = required(name, value);
        if (number < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, was: " + number);
        }
        return number;
    }

    static double positive(String name, ConfigValue<? extends Number> value) {
        double number = required(name, value);
        if (number <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, was: " + number);
        }
        return number;
    }

    /**
     * Resolves an optional bound; null (literal or resolved) means unbounded.
     */
    static Double optionalNonNegative(String name, ConfigValue<? extends Number> value) {
        if (value == null) {
            return null;
        }
        Number resolved = value.resolve();
        if (resolved == null) {
            return null;
        }
        double number = resolved.doubleValue();
        if (Double.isNaN(number) || number < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, was: " + number);
        }
        return number;
    }

    static void requireNonNegativeLiteral(String name, double value) {
        if (Double.isNaN(value) || value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, was: " + value);
        }
    }

    static <T> ConfigValue<T> resolver(String name, Supplier<? extends T> supplier) {
        Objects.requireNonNull(supplier, name + " supplier must not be null");
        return ConfigValue.resolvedBy(supplier);
    }
}
