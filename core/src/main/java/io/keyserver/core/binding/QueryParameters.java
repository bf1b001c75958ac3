package io.keyserver.core.binding;

import io.keyserver.core.error.ParameterParseException;
import java.util.List;
import java.util.Optional;

/**
 * Typed access to query parameters. A parameter that is absent, or present with
 * an empty value, yields the field's zero value. The first value wins when a
 * parameter is repeated.
 *
 * <p>
 * Numeric parameters accept plain decimal digits only. Signs, blanks and
 * values out of range are rejected with {@link ParameterParseException}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class QueryParameters {

    private QueryParameters() {
        // utility class
    }

    /** First value of {@code name}, or empty when absent or empty. */
    public static Optional<String> first(BoundRequest request, String name) {
        List<String> values = request.queryParameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    /** First value of {@code name}, or {@code ""}. */
    public static String string(BoundRequest request, String name) {
        return first(request, name).orElse("");
    }

    /**
     * Parses {@code name} as an unsigned 64-bit integer. The result is held in a
     * {@code long} and must be read with the unsigned helpers of {@link Long}.
     *
     * @return the value, or {@code 0} when absent
     * @throws ParameterParseException if the value is not an unsigned 64-bit
     *                                 decimal
     */
    public static long unsigned64(BoundRequest request, String name) {
        Optional<String> raw = first(request, name);
        if (raw.isEmpty()) {
            return 0L;
        }
        String value = raw.get();
        requireDigits(name, value);
        try {
            return Long.parseUnsignedLong(value);
        } catch (NumberFormatException e) {
            throw new ParameterParseException(
                    "Query parameter '" + name + "' is out of range: " + value, e, name);
        }
    }

    /**
     * Parses {@code name} as a non-negative 32-bit integer.
     *
     * @return the value, or {@code 0} when absent
     * @throws ParameterParseException if the value is negative, non-numeric or
     *                                 larger than {@link Integer#MAX_VALUE}
     */
    public static int nonNegative32(BoundRequest request, String name) {
        Optional<String> raw = first(request, name);
        if (raw.isEmpty()) {
            return 0;
        }
        String value = raw.get();
        requireDigits(name, value);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ParameterParseException(
                    "Query parameter '" + name + "' is out of range: " + value, e, name);
        }
    }

    private static void requireDigits(String name, String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                throw new ParameterParseException(
                        "Query parameter '" + name + "' must be a non-negative integer: " + value, name);
            }
        }
    }
}
