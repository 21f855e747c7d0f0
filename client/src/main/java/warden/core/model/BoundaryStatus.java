package warden.core.model;

import warden.core.model.problem.CredentialException;

/**
 * Numeric status codes for callers that cannot receive exceptions, such as a
 * native bridge.
 */
public enum BoundaryStatus {
    OK(0),
    OUT_OF_MEMORY(1),
    INVALID_ARGUMENT(2),
    NOT_FOUND(3),
    UNKNOWN(99);

    private final int code;

    BoundaryStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Map a failure to its boundary status; {@code null} maps to {@link #OK}.
     */
    public static BoundaryStatus of(Throwable error) {
        if (error == null) {
            return OK;
        }
        if (error instanceof OutOfMemoryError) {
            return OUT_OF_MEMORY;
        }
        if (error instanceof IllegalArgumentException) {
            return INVALID_ARGUMENT;
        }
        if (error instanceof CredentialException ce) {
            return switch (ce.kind()) {
                case INVALID_CONFIG, STATE_MISMATCH -> INVALID_ARGUMENT;
                case SESSION_NOT_FOUND, TOKEN_NOT_FOUND, NO_REFRESH_TOKEN -> NOT_FOUND;
                default -> UNKNOWN;
            };
        }
        return UNKNOWN;
    }
}
