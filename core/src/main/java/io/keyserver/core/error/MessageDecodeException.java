package io.keyserver.core.error;

/** Thrown when the (rewritten) request body cannot be decoded into the route's request message. */
public final class MessageDecodeException extends BindingException {

    private static final long serialVersionUID = 1L;

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause, Stage.DECODE);
    }
}
