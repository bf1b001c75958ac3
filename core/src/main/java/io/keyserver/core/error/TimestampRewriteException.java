package io.keyserver.core.error;

import java.util.Arrays;

/**
 * Thrown when a timestamp-bearing field holds a quoted value that is not an
 * RFC3339 timestamp (the empty string included).
 *
 * <p>
 * The exception carries the body exactly as it was received. Rewrites that
 * succeeded earlier in the same pass are not reflected in it.
 */
public final class TimestampRewriteException extends BindingException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String value;
    private final byte[] originalBody;

    public TimestampRewriteException(String field, String value, byte[] originalBody, Throwable cause) {
        super("Field '" + field + "' is not an RFC3339 timestamp: \"" + value + "\"", cause, Stage.TIMESTAMP_REWRITE);
        this.field = field;
        this.value = value;
        this.originalBody = originalBody != null ? originalBody.clone() : new byte[0];
    }

    /** The field name whose value failed to parse. */
    public String field() {
        return field;
    }

    /** The quoted text that failed to parse. */
    public String value() {
        return value;
    }

    /** A copy of the unmodified request body. */
    public byte[] originalBody() {
        return Arrays.copyOf(originalBody, originalBody.length);
    }
}
