package org.javai.backoff;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The arguments of one call to a retried operation.
 *
 * <p>Positional arguments may contain nulls. Keyword arguments keep their insertion order.
 * Both are unmodifiable, so the same instance can be handed to every attempt and to every
 * observer without copying.
 *
 * @param positional positional arguments, in call order
 * @param keyword keyword arguments by name
 */
public record Arguments(List<Object> positional, Map<String, Object> keyword) {

    private static final Arguments EMPTY = new Arguments(List.of(), Map.of());

    public Arguments {
        Objects.requireNonNull(positional, "positional must not be null");
        Objects.requireNonNull(keyword, "keyword must not be null");
        positional = Collections.unmodifiableList(Arrays.asList(positional.toArray()));
        keyword = Collections.unmodifiableMap(new LinkedHashMap<>(keyword));
    }

    public static Arguments empty() {
        return EMPTY;
    }

    public static Arguments of(Object... positional) {
        if (positional == null) {
            return new Arguments(Collections.singletonList(null), Map.of());
        }
        return new Arguments(Arrays.asList(positional), Map.of());
    }

    /**
     * Returns a copy with one more keyword argument. A repeated name replaces the earlier value.
     */
    public Arguments withKeyword(String name, Object value) {
        Objects.requireNonNull(name, "name must not be null");
        Map<String, Object> merged = new LinkedHashMap<>(keyword);
        merged.put(name, value);
        return new Arguments(positional, merged);
    }

    /**
     * Returns the positional argument at {@code index}.
     */
    public Object get(int index) {
        return positional.get(index);
    }

    /**
     * Returns the keyword argument called {@code name}, or null if absent.
     */
    public Object get(String name) {
        return keyword.get(name);
    }
}
