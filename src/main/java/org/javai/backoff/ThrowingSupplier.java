package org.javai.backoff;

/**
 * A supplier that may throw a checked exception.
 * Used by retriers to wrap argument-less work.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
