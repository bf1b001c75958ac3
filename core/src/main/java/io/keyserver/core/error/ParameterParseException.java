package io.keyserver.core.error;

/** Thrown when a path variable is missing or a query parameter is malformed or out of range. */
public final class ParameterParseException extends BindingException {

    private static final long serialVersionUID = 1L;

    private final String parameter;

    public ParameterParseException(String message, String parameter) {
        super(message, Stage.PARAMETERS);
        this.parameter = parameter;
    }

    public ParameterParseException(String message, Throwable cause, String parameter) {
        super(message, cause, Stage.PARAMETERS);
        this.parameter = parameter;
    }

    /** Name of the offending path variable or query parameter. */
    public String parameter() {
        return parameter;
    }
}
