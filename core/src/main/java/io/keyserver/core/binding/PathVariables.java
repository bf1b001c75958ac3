package io.keyserver.core.binding;

import io.keyserver.core.error.ParameterParseException;
import java.util.Optional;

/**
 * Reads variables bound by the route template, e.g. {@code user_id} in
 * {@code /v2/users/{user_id}}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class PathVariables {

    private PathVariables() {
        // utility class
    }

    /**
     * Returns the value bound to {@code name}, or empty when the matched route
     * does not declare the variable or nothing was bound to it.
     *
     * @param request the routed request
     * @param name    the template variable name
     * @return the decoded segment value, if bound
     */
    public static Optional<String> find(BoundRequest request, String name) {
        return Optional.ofNullable(request.pathVariables().get(name));
    }

    /**
     * Returns the value bound to {@code name}.
     *
     * @throws ParameterParseException if the variable is not bound
     */
    public static String require(BoundRequest request, String name) {
        return find(request, name)
                .orElseThrow(() -> new ParameterParseException(
                        "Path variable '" + name + "' is not bound for " + request.path(), name));
    }
}
