package org.javai.backoff.retry;

import org.javai.backoff.Arguments;
import org.javai.backoff.Operation;

import java.util.Objects;

/**
 * An operation bound to a retrier: each call runs a full retry loop.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryingOperation<User> fetchUser = retrier.bind("fetchUser", args -> api.fetch((String) args.get(0)));
 * User user = fetchUser.call("user-42");
 * }</pre>
 *
 * @param <T> The type of result
 */
public final class RetryingOperation<T> implements Operation<T> {

    private final String target;
    private final Operation<T> retrying;

    RetryingOperation(String target, Operation<T> retrying) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.retrying = Objects.requireNonNull(retrying, "retrying must not be null");
    }

    public String target() {
        return target;
    }

    /**
     * Calls the operation with positional arguments, retrying as configured.
     */
    public T call(Object... args) throws Exception {
        return invoke(Arguments.of(args));
    }

    @Override
    public T invoke(Arguments arguments) throws Exception {
        return retrying.invoke(Objects.requireNonNull(arguments, "arguments must not be null"));
    }
}
