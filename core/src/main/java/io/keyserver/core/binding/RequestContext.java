package io.keyserver.core.binding;

import io.keyserver.core.model.HttpMethod;
import java.time.Instant;

/**
 * Request-scoped values handed to backend handlers.
 *
 * @param requestId  correlation id, echoed in the {@code X-Request-ID} response
 *                   header
 * @param method     HTTP method of the request
 * @param path       request path
 * @param receivedAt when the pipeline started processing the request
 */
public record RequestContext(String requestId, HttpMethod method, String path, Instant receivedAt) {

    /** Derives the context of {@code request}, stamped with the current time. */
    public static RequestContext of(BoundRequest request) {
        return new RequestContext(request.requestId(), request.method(), request.path(), Instant.now());
    }
}
