package io.keyserver.server.http;

import io.javalin.http.Context;
import io.keyserver.core.binding.BoundRequest;
import io.keyserver.core.model.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies what the binding layer needs out of a Javalin {@link Context}.
 *
 * <p>
 * Javalin has already matched the route and decoded the path variables and
 * query parameters; this adapter only moves them into a {@link BoundRequest}.
 * Header names and cookies are not carried.
 */
public final class JavalinRequestAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(JavalinRequestAdapter.class);

    /**
     * @param ctx       the matched request
     * @param requestId correlation id of the request
     * @param body      the body as already read by the caller
     * @return the routed request
     * @throws IllegalArgumentException if the method has no {@link HttpMethod}
     *                                  counterpart
     */
    public BoundRequest bind(Context ctx, String requestId, byte[] body) {
        HttpMethod method = HttpMethod.valueOf(ctx.method().name());
        BoundRequest request = new BoundRequest(
                requestId, method, ctx.path(), ctx.pathParamMap(), ctx.queryParamMap(), body);
        LOG.debug(
                "bind: {} {} (pathVariables={}, queryParameters={}, body={} bytes)",
                method,
                request.path(),
                request.pathVariables().keySet(),
                request.queryParameters().keySet(),
                body == null ? 0 : body.length);
        return request;
    }
}
