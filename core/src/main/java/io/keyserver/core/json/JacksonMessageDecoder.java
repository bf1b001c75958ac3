package io.keyserver.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.keyserver.core.error.MessageDecodeException;
import io.keyserver.core.model.RequestMessage;
import io.keyserver.core.spi.MessageDecoder;
import java.io.IOException;

/**
 * {@link MessageDecoder} backed by Jackson. Decoding updates the given message
 * in place, so path and query fields survive unless the body names them too.
 *
 * <p>
 * Unknown fields are ignored. Trailing tokens after the top-level value are
 * rejected.
 *
 * <p>
 * Thread-safe: the underlying {@link ObjectMapper} is configured once.
 */
public final class JacksonMessageDecoder implements MessageDecoder {

    private final ObjectMapper mapper;

    public JacksonMessageDecoder() {
        this(new ObjectMapper());
    }

    /** Uses a copy of {@code mapper} with the decoder's features applied. */
    public JacksonMessageDecoder(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    @Override
    public void decode(byte[] body, RequestMessage target) {
        try {
            mapper.readerForUpdating(target).readValue(body);
        } catch (JsonProcessingException e) {
            throw new MessageDecodeException(
                    "Request body is not a valid " + target.getClass().getSimpleName() + ": "
                            + e.getOriginalMessage(),
                    e);
        } catch (IOException e) {
            throw new MessageDecodeException("Failed to read request body: " + e.getMessage(), e);
        }
    }
}
