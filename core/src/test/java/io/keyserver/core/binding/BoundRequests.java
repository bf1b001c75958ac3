package io.keyserver.core.binding;

import io.keyserver.core.model.HttpMethod;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builds {@link BoundRequest}s from a request target the way the router would. */
public final class BoundRequests {

    private BoundRequests() {
        // utility class
    }

    /**
     * @param method        HTTP method
     * @param target        path plus optional query string, e.g.
     *                      {@code /v2/seh?page_size=3}
     * @param pathVariables variables the route template bound
     * @param body          request body, may be {@code null}
     */
    public static BoundRequest of(HttpMethod method, String target, Map<String, String> pathVariables, String body) {
        int q = target.indexOf('?');
        String path = q < 0 ? target : target.substring(0, q);
        Map<String, List<String>> query = q < 0 ? Map.of() : parseQuery(target.substring(q + 1));
        return new BoundRequest(
                "test-request",
                method,
                path,
                pathVariables,
                query,
                body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    public static BoundRequest get(String target, Map<String, String> pathVariables) {
        return of(HttpMethod.GET, target, pathVariables, null);
    }

    public static BoundRequest get(String target) {
        return get(target, Map.of());
    }

    static Map<String, List<String>> parseQuery(String query) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        if (query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String name = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            params.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }
        return params;
    }
}
