package io.keyserver.core.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.keyserver.core.error.BackendException;
import io.keyserver.core.error.BindingException;
import java.util.Locale;

/**
 * Builds RFC 9457 Problem Details bodies for every error the REST layer
 * answers with.
 *
 * <p>
 * Every method returns a {@link JsonNode} in RFC 9457 format:
 * <pre>{@code
 * {
 * "type": "urn:keyserver:rest:invalid-timestamp",
 * "title": "Bad Request",
 * "status": 400,
 * "detail": "Field 'creation_time' is not an RFC3339 timestamp: \"invalid\"",
 * "instance": "/v2/users/alice@example.com"
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe: all methods are stateless.
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_PREFIX = "urn:keyserver:rest:";
    static final String URN_INVALID_PARAMETER = URN_PREFIX + "invalid-parameter";
    static final String URN_INVALID_TIMESTAMP = URN_PREFIX + "invalid-timestamp";
    static final String URN_MALFORMED_BODY = URN_PREFIX + "malformed-body";
    static final String URN_BODY_TOO_LARGE = URN_PREFIX + "body-too-large";
    static final String URN_INTERNAL_ERROR = URN_PREFIX + "internal-error";
    static final String URN_BACKEND_PREFIX = URN_PREFIX + "backend:";

    private ProblemDetail() {
        // utility class
    }

    /**
     * Request rejected while binding it to its message (400).
     *
     * @param e            the binding failure
     * @param instancePath the request path
     * @return RFC 9457 JSON
     */
    public static JsonNode bindingFailed(BindingException e, String instancePath) {
        String type =
                switch (e.stage()) {
                    case PARAMETERS -> URN_INVALID_PARAMETER;
                    case TIMESTAMP_REWRITE -> URN_INVALID_TIMESTAMP;
                    case DECODE -> URN_MALFORMED_BODY;
                };
        return build(type, "Bad Request", 400, e.detail(), instancePath);
    }

    /**
     * Backend rejected or failed the call; the status code follows
     * {@link BackendException.Status#httpStatus()}.
     *
     * @param e            the backend failure
     * @param instancePath the request path
     * @return RFC 9457 JSON
     */
    public static JsonNode backendFailed(BackendException e, String instancePath) {
        int status = e.status().httpStatus();
        String type = URN_BACKEND_PREFIX + e.status().name().toLowerCase(Locale.ROOT).replace('_', '-');
        return build(type, reasonPhrase(status), status, e.getMessage(), instancePath);
    }

    /**
     * Request body exceeds {@code server.max-body-bytes} (413).
     *
     * @param detail       human-readable description
     * @param instancePath the request path
     * @return RFC 9457 JSON
     */
    public static JsonNode bodyTooLarge(String detail, String instancePath) {
        return build(URN_BODY_TOO_LARGE, "Payload Too Large", 413, detail, instancePath);
    }

    /**
     * Unexpected failure (500). The detail never carries exception text.
     *
     * @param detail       human-readable description
     * @param instancePath the request path
     * @return RFC 9457 JSON
     */
    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    /**
     * Builds a standard RFC 9457 Problem Details JSON object.
     *
     * @param type         URN identifying the error category
     * @param title        short human-readable title
     * @param status       HTTP status code
     * @param detail       human-readable description
     * @param instancePath request path (may be null)
     * @return the problem document
     */
    static JsonNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }

    static String reasonPhrase(int status) {
        return switch (status) {
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 409 -> "Conflict";
            case 429 -> "Too Many Requests";
            case 499 -> "Client Closed Request";
            case 501 -> "Not Implemented";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "Internal Server Error";
        };
    }
}
