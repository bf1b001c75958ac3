package io.keyserver.core.binding;

import io.keyserver.core.error.ParameterParseException;
import io.keyserver.core.model.RequestMessage;

/**
 * Copies path variables and query parameters of a routed request onto a freshly
 * allocated request message.
 *
 * @param <M> the message type of the route
 */
@FunctionalInterface
public interface ParameterParser<M extends RequestMessage> {

    /** A parser for routes whose message takes nothing from the URL. */
    static <M extends RequestMessage> ParameterParser<M> none() {
        return (request, message) -> {};
    }

    /**
     * @throws ParameterParseException if a required path variable is missing or a
     *                                 parameter is malformed
     */
    void parse(BoundRequest request, M message);
}
