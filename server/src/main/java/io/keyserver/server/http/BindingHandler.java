package io.keyserver.server.http;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.keyserver.core.binding.BoundRequest;
import io.keyserver.core.binding.RouteBinding;
import io.keyserver.core.dispatch.DispatchPipeline;
import io.keyserver.core.dispatch.DispatchResult;
import io.keyserver.core.dispatch.ProblemDetail;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Javalin handler for one {@link RouteBinding}.
 *
 * <p>
 * Per request:
 * <ol>
 * <li>Take the {@code X-Request-ID} header, or generate a UUID, and echo it on
 * the response</li>
 * <li>Reject bodies over the configured limit with {@code 413}</li>
 * <li>Build the {@link BoundRequest} and run it through the
 * {@link DispatchPipeline}</li>
 * <li>Write the resulting status, content type and JSON body</li>
 * </ol>
 *
 * <p>
 * The request id is in the MDC under {@code requestId} for the duration of the
 * call.
 *
 * @param <B> backend type
 */
public final class BindingHandler<B> implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(BindingHandler.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String MDC_REQUEST_ID = "requestId";

    private final RouteBinding<B, ?, ?> binding;
    private final DispatchPipeline<B> pipeline;
    private final JavalinRequestAdapter adapter;
    private final int maxBodyBytes;

    /**
     * @param binding      the route this handler serves
     * @param pipeline     dispatch pipeline shared by all routes
     * @param adapter      Javalin-to-{@link BoundRequest} adapter
     * @param maxBodyBytes largest accepted body in bytes (≤ 0 for no limit)
     */
    public BindingHandler(
            RouteBinding<B, ?, ?> binding,
            DispatchPipeline<B> pipeline,
            JavalinRequestAdapter adapter,
            int maxBodyBytes) {
        this.binding = Objects.requireNonNull(binding, "binding must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.adapter = Objects.requireNonNull(adapter, "adapter must not be null");
        this.maxBodyBytes = maxBodyBytes;
    }

    public RouteBinding<B, ?, ?> binding() {
        return binding;
    }

    @Override
    public void handle(Context ctx) {
        String requestId = ctx.header(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        ctx.header(REQUEST_ID_HEADER, requestId);

        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            if (maxBodyBytes > 0 && ctx.contentLength() > maxBodyBytes) {
                rejectTooLarge(ctx, ctx.contentLength());
                return;
            }
            // chunked bodies carry no Content-Length
            byte[] body = ctx.bodyAsBytes();
            if (maxBodyBytes > 0 && body.length > maxBodyBytes) {
                rejectTooLarge(ctx, body.length);
                return;
            }

            BoundRequest request = adapter.bind(ctx, requestId, body);
            DispatchResult result = pipeline.dispatch(binding, request);
            LOG.debug("{} {} -> {}", binding.name(), request.path(), result.status());
            write(ctx, result);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private void rejectTooLarge(Context ctx, long size) {
        LOG.warn("Request body too large: {} bytes (limit {})", size, maxBodyBytes);
        write(ctx, DispatchResult.problem(
                ProblemDetail.bodyTooLarge("Request body exceeds " + maxBodyBytes + " bytes", ctx.path())));
    }

    private static void write(Context ctx, DispatchResult result) {
        ctx.status(result.status());
        ctx.contentType(result.contentType());
        ctx.result(result.body().toString());
    }
}
