package io.keyserver.core.binding;

import io.keyserver.core.model.HttpMethod;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of a routed HTTP request, taken by the server adapter after the
 * router matched the request to a binding.
 *
 * <p>
 * Path variables and query parameters are already URL-decoded. The body is
 * copied on the way in and on the way out, so the bytes the pipeline reads are
 * exactly the bytes that arrived.
 *
 * @param requestId       correlation id of the request
 * @param method          HTTP method
 * @param path            request path without query string
 * @param pathVariables   values bound to the route template's variables
 * @param queryParameters query parameters, all values per name in arrival order
 * @param body            raw request body, empty when absent
 */
public record BoundRequest(
        String requestId,
        HttpMethod method,
        String path,
        Map<String, String> pathVariables,
        Map<String, List<String>> queryParameters,
        byte[] body) {

    public BoundRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        pathVariables = pathVariables == null ? Map.of() : Map.copyOf(pathVariables);
        queryParameters = copyQuery(queryParameters);
        body = body == null ? new byte[0] : body.clone();
    }

    /** Returns a copy of the body. */
    @Override
    public byte[] body() {
        return body.clone();
    }

    private static Map<String, List<String>> copyQuery(Map<String, List<String>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((name, values) -> copy.put(name, values == null ? List.of() : List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundRequest that)) return false;
        return Objects.equals(requestId, that.requestId)
                && method == that.method
                && path.equals(that.path)
                && pathVariables.equals(that.pathVariables)
                && queryParameters.equals(that.queryParameters)
                && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(requestId, method, path, pathVariables, queryParameters) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "BoundRequest[" + method + " " + path + ", pathVariables=" + pathVariables + ", query="
                + queryParameters + ", body=" + body.length + " bytes]";
    }
}
