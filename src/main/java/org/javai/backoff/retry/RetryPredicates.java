package org.javai.backoff.retry;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Predicates for predicate-triggered retries.
 */
public final class RetryPredicates {

    private RetryPredicates() {}

    /**
     * Keeps retrying while the result is "empty": null, {@code false}, numeric zero, an empty
     * string, collection, map, array or optional. The default for predicate-triggered retries.
     */
    public static <T> Predicate<T> falsy() {
        return RetryPredicates::isFalsy;
    }

    static boolean isFalsy(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Boolean bool) {
            return !bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() == 0;
        }
        if (value instanceof CharSequence text) {
            return text.length() == 0;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value instanceof Optional<?> optional) {
            return optional.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        return false;
    }
}
