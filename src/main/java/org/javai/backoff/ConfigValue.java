package org.javai.backoff;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A configuration value that is either fixed up front or computed when needed.
 *
 * <p>Retry bounds are resolved once per invocation of the retried operation; wait
 * generator parameters once per started wait sequence. A resolver is therefore
 * consulted again for each new call, which allows values read from live settings.
 *
 * @param <T> The type of value
 */
public sealed interface ConfigValue<T> permits ConfigValue.Literal, ConfigValue.Resolver {

    /**
     * Returns the value, invoking the resolver if there is one.
     */
    T resolve();

    static <T> ConfigValue<T> of(T value) {
        return new Literal<>(value);
    }

    static <T> ConfigValue<T> resolvedBy(Supplier<? extends T> supplier) {
        return new Resolver<>(supplier);
    }

    /**
     * A fixed value. May be null where the setting allows it.
     */
    record Literal<T>(T value) implements ConfigValue<T> {
        @Override
        public T resolve() {
            return value;
        }
    }

    /**
     * A value computed by a supplier at resolution time.
     */
    record Resolver<T>(Supplier<? extends T> supplier) implements ConfigValue<T> {
        public Resolver {
            Objects.requireNonNull(supplier, "supplier must not be null");
        }

        @Override
        public T resolve() {
            return supplier.get();
        }
    }
}
