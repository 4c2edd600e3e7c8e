package org.javai.backoff;

import java.util.concurrent.CompletableFuture;

/**
 * The work retried by an asynchronous retrier.
 *
 * <p>Failures may be reported either by throwing or by completing the returned
 * future exceptionally; both are handled the same way.
 *
 * @param <T> The type of result
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    CompletableFuture<T> invoke(Arguments arguments) throws Exception;
}
