package io.keyserver.core.binding;

import io.keyserver.core.error.BackendException;
import io.keyserver.core.model.RequestMessage;

/**
 * Invokes the backend operation behind a route.
 *
 * @param <B> backend type
 * @param <M> request message type
 * @param <R> result type, serialized as the JSON response body
 */
@FunctionalInterface
public interface BackendHandler<B, M extends RequestMessage, R> {

    /**
     * @param backend the backend instance the server was built with
     * @param ctx     the request-scoped context
     * @param message the fully populated request message
     * @return the result to serialize
     * @throws BackendException if the backend rejects or fails the call
     */
    R handle(B backend, RequestContext ctx, M message);
}
