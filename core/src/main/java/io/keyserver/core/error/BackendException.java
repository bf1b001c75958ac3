package io.keyserver.core.error;

import java.util.Objects;

/**
 * Error returned by a backend handler. The {@link Status} mirrors the RPC
 * status codes of the key server backend and decides the HTTP status of the
 * response.
 */
public class BackendException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** RPC status codes with their HTTP equivalents. */
    public enum Status {
        CANCELLED(499),
        UNKNOWN(500),
        INVALID_ARGUMENT(400),
        DEADLINE_EXCEEDED(504),
        NOT_FOUND(404),
        ALREADY_EXISTS(409),
        PERMISSION_DENIED(403),
        RESOURCE_EXHAUSTED(429),
        FAILED_PRECONDITION(400),
        ABORTED(409),
        OUT_OF_RANGE(400),
        UNIMPLEMENTED(501),
        INTERNAL(500),
        UNAVAILABLE(503),
        DATA_LOSS(500),
        UNAUTHENTICATED(401);

        private final int httpStatus;

        Status(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        /** HTTP status code a response carrying this status is sent with. */
        public int httpStatus() {
            return httpStatus;
        }
    }

    private final Status status;

    public BackendException(Status status, String message) {
        super(message);
        this.status = Objects.requireNonNull(status, "status");
    }

    public BackendException(Status status, String message, Throwable cause) {
        super(message, cause);
        this.status = Objects.requireNonNull(status, "status");
    }

    public Status status() {
        return status;
    }
}
