package io.keyserver.core.spi;

import io.keyserver.core.error.MessageDecodeException;
import io.keyserver.core.model.RequestMessage;

/**
 * Decodes a JSON request body into a request message that already carries the
 * path- and query-derived fields. Fields present in the body overwrite them.
 *
 * <p>
 * Implementations MUST be thread-safe.
 */
public interface MessageDecoder {

    /**
     * Decodes {@code body} onto {@code target}.
     *
     * @param body   the JSON body, already timestamp-rewritten; never empty
     * @param target the message to populate
     * @throws MessageDecodeException if the body is not valid JSON for the
     *                                message type
     */
    void decode(byte[] body, RequestMessage target);
}
