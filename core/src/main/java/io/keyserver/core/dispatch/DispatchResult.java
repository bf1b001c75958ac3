package io.keyserver.core.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Outcome of dispatching one request: the HTTP status and JSON body to send.
 *
 * @param status  HTTP status code
 * @param body    JSON response body; an RFC 9457 document when {@code problem}
 * @param problem whether {@code body} is a problem document
 */
public record DispatchResult(int status, JsonNode body, boolean problem) {

    public static final String JSON = "application/json";
    public static final String PROBLEM_JSON = "application/problem+json";

    public DispatchResult {
        Objects.requireNonNull(body, "body must not be null");
    }

    public static DispatchResult ok(JsonNode body) {
        return new DispatchResult(200, body, false);
    }

    /** A problem response whose status is taken from the document itself. */
    public static DispatchResult problem(JsonNode problem) {
        return new DispatchResult(problem.path("status").asInt(500), problem, true);
    }

    public String contentType() {
        return problem ? PROBLEM_JSON : JSON;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
