package io.keyserver.core.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.keyserver.core.binding.BoundRequest;
import io.keyserver.core.binding.RequestContext;
import io.keyserver.core.binding.RouteBinding;
import io.keyserver.core.error.BackendException;
import io.keyserver.core.error.BindingException;
import io.keyserver.core.json.TimestampRewriter;
import io.keyserver.core.model.RequestMessage;
import io.keyserver.core.spi.MessageDecoder;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one routed request through its {@link RouteBinding}.
 *
 * <p>
 * Steps:
 * <ol>
 * <li>Allocate the binding's request message</li>
 * <li>Copy path variables and query parameters onto it</li>
 * <li>Rewrite RFC3339 values of the binding's timestamp fields in the body</li>
 * <li>Decode the rewritten body onto the message (skipped for a blank body)</li>
 * <li>Invoke the handler with the backend, the request context and the
 * message</li>
 * <li>Serialize the result, or translate the failure into a problem
 * response</li>
 * </ol>
 *
 * <p>
 * A failure in steps 2–4 is a client error ({@code 400}); the handler is not
 * invoked and the message is dropped. Handler failures are mapped by
 * {@link BackendException.Status}; anything else becomes {@code 500}.
 *
 * <p>
 * This class is thread-safe: all per-request state is local to
 * {@link #dispatch}.
 *
 * @param <B> backend type
 */
public final class DispatchPipeline<B> {

    private static final Logger LOG = LoggerFactory.getLogger(DispatchPipeline.class);

    private final B backend;
    private final MessageDecoder decoder;
    private final ObjectMapper mapper;

    /**
     * @param backend the backend every handler is invoked with
     * @param decoder decodes request bodies
     * @param mapper  serializes handler results
     */
    public DispatchPipeline(B backend, MessageDecoder decoder, ObjectMapper mapper) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public B backend() {
        return backend;
    }

    /**
     * Dispatches {@code request} through {@code binding}.
     *
     * @param binding the route the request matched
     * @param request the routed request
     * @return the response to send; never {@code null}
     */
    public <M extends RequestMessage, R> DispatchResult dispatch(RouteBinding<B, M, R> binding, BoundRequest request) {
        M message;
        try {
            message = bind(binding, request);
        } catch (BindingException e) {
            LOG.warn(
                    "{} rejected at {}: {} (requestId={})",
                    binding.name(),
                    e.stage(),
                    e.detail(),
                    request.requestId());
            return DispatchResult.problem(ProblemDetail.bindingFailed(e, request.path()));
        }

        RequestContext ctx = RequestContext.of(request);
        R result;
        try {
            result = binding.handler().handle(backend, ctx, message);
        } catch (BackendException e) {
            if (e.status().httpStatus() >= 500) {
                LOG.error("{} failed: {} {} (requestId={})", binding.name(), e.status(), e.getMessage(),
                        request.requestId(), e);
            } else {
                LOG.info("{} refused: {} {} (requestId={})", binding.name(), e.status(), e.getMessage(),
                        request.requestId());
            }
            return DispatchResult.problem(ProblemDetail.backendFailed(e, request.path()));
        } catch (RuntimeException e) {
            LOG.error("{} failed unexpectedly (requestId={})", binding.name(), request.requestId(), e);
            return DispatchResult.problem(
                    ProblemDetail.internalError("The backend failed to process the request", request.path()));
        }

        return serialize(binding, request, result);
    }

    /**
     * Steps 1–4: builds the fully populated request message.
     *
     * @throws BindingException if parameters, timestamps or the body are invalid
     */
    <M extends RequestMessage> M bind(RouteBinding<B, M, ?> binding, BoundRequest request) {
        M message = binding.newMessage();
        binding.parser().parse(request, message);

        byte[] body = TimestampRewriter.rewriteAll(request.body(), binding.timestampFields());
        if (!isBlank(body)) {
            decoder.decode(body, message);
        }
        LOG.debug("{} bound {}", binding.name(), message);
        return message;
    }

    private <R> DispatchResult serialize(RouteBinding<B, ?, R> binding, BoundRequest request, R result) {
        if (result == null) {
            return DispatchResult.ok(mapper.createObjectNode());
        }
        try {
            JsonNode body = mapper.valueToTree(result);
            return DispatchResult.ok(body);
        } catch (IllegalArgumentException e) {
            LOG.error("{} returned an unserializable result (requestId={})", binding.name(),
                    request.requestId(), e);
            return DispatchResult.problem(
                    ProblemDetail.internalError("The response could not be serialized", request.path()));
        }
    }

    private static boolean isBlank(byte[] body) {
        for (byte b : body) {
            if (b != ' ' && b != '\t' && b != '\n' && b != '\r') {
                return false;
            }
        }
        return true;
    }
}
