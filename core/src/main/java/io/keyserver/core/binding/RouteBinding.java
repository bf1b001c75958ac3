package io.keyserver.core.binding;

import io.keyserver.core.model.HttpMethod;
import io.keyserver.core.model.RequestMessage;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Static description of one REST route: which request it answers, how the
 * request message is built from it, and which backend operation it calls.
 *
 * <p>
 * Immutable. Everything here is fixed at registration; the only per-request
 * allocation is the message obtained from {@link #newMessage()}.
 *
 * @param name            operation name used in logs, e.g. {@code GetEntryV2}
 * @param pathPattern     router path template, e.g. {@code /v2/users/{user_id}}
 * @param method          HTTP method
 * @param prototype       allocates an empty request message
 * @param parser          copies path and query values onto the message
 * @param handler         calls the backend
 * @param timestampFields body fields carrying RFC3339 strings to rewrite before
 *                        decoding; no entry may be null or blank
 * @param <B>             backend type
 * @param <M>             request message type
 * @param <R>             result type
 */
public record RouteBinding<B, M extends RequestMessage, R>(
        String name,
        String pathPattern,
        HttpMethod method,
        Supplier<M> prototype,
        ParameterParser<M> parser,
        BackendHandler<B, M, R> handler,
        List<String> timestampFields) {

    public RouteBinding {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(pathPattern, "pathPattern must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(prototype, "prototype must not be null");
        Objects.requireNonNull(parser, "parser must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        if (!pathPattern.startsWith("/")) {
            throw new IllegalArgumentException("pathPattern must start with '/': " + pathPattern);
        }
        timestampFields = timestampFields == null ? List.of() : List.copyOf(timestampFields);
        for (String field : timestampFields) {
            if (field.isBlank()) {
                throw new IllegalArgumentException("timestampFields of " + name + " must not contain a blank name");
            }
        }
    }

    /** Allocates the request message for one request. */
    public M newMessage() {
        return prototype.get();
    }
}
