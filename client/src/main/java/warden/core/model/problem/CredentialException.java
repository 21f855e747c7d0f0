package warden.core.model.problem;

import java.util.Optional;

/**
 * Failure raised by credential lifecycle operations.
 *
 * <p>Instances are created through {@link CredentialProblem}. The {@link Kind}
 * identifies the failure; server-reported errors also carry the OAuth error
 * code, its description, the HTTP status and the raw response body.
 */
public class CredentialException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Failure taxonomy.
     */
    public enum Kind {
        INVALID_CONFIG,
        SESSION_NOT_FOUND,
        SESSION_EXPIRED,
        STATE_MISMATCH,
        TOKEN_NOT_FOUND,
        NO_REFRESH_TOKEN,
        TRANSPORT_ERROR,
        TOKEN_ENDPOINT_ERROR,
        LOCK_TIMEOUT,
        STORAGE_FAILURE,
        AUTHORIZATION_DENIED,
        DEVICE_CODE_EXPIRED,
        UNSUPPORTED_OPERATION,
        INTERRUPTED,
        REGISTRATION_FAILED,
        CALLBACK_TIMEOUT
    }

    private final Kind kind;
    private final String serverError;
    private final String serverErrorDescription;
    private final Integer httpStatus;
    private final String rawBody;

    CredentialException(Kind kind, String message, Throwable cause) {
        this(kind, message, cause, null, null, null, null);
    }

    CredentialException(
            Kind kind,
            String message,
            Throwable cause,
            String serverError,
            String serverErrorDescription,
            Integer httpStatus,
            String rawBody) {
        super(message, cause);
        this.kind = kind;
        this.serverError = serverError;
        this.serverErrorDescription = serverErrorDescription;
        this.httpStatus = httpStatus;
        this.rawBody = rawBody;
    }

    public Kind kind() {
        return kind;
    }

    public Optional<String> serverError() {
        return Optional.ofNullable(serverError);
    }

    public Optional<String> serverErrorDescription() {
        return Optional.ofNullable(serverErrorDescription);
    }

    public Optional<Integer> httpStatus() {
        return Optional.ofNullable(httpStatus);
    }

    public Optional<String> rawBody() {
        return Optional.ofNullable(rawBody);
    }
}
