package io.keyserver.core.error;

/**
 * Abstract base for all request-binding failures. Never thrown directly; use
 * {@link ParameterParseException}, {@link TimestampRewriteException} or
 * {@link MessageDecodeException}.
 *
 * <p>
 * Every binding failure is a client error: the request is rejected before the
 * backend handler runs.
 */
public abstract class BindingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline stage in which the request was rejected. */
    public enum Stage {
        PARAMETERS,
        TIMESTAMP_REWRITE,
        DECODE
    }

    private final Stage stage;

    protected BindingException(String message, Stage stage) {
        super(message);
        this.stage = stage;
    }

    protected BindingException(String message, Throwable cause, Stage stage) {
        super(message, cause);
        this.stage = stage;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The stage in which binding failed. */
    public Stage stage() {
        return stage;
    }
}
