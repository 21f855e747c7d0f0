package warden.core.model.problem;

import java.time.Duration;

import warden.core.model.problem.CredentialException.Kind;

/**
 * Factory for {@link CredentialException} instances.
 *
 * <p>Provides one static factory per failure so that messages stay consistent
 * across the flow client, the refresher and the storage adapters.
 */
public final class CredentialProblem {

    private CredentialProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Configuration Errors ==========

    public static CredentialException invalidConfig(String detail) {
        return new CredentialException(Kind.INVALID_CONFIG, "Invalid OAuth configuration: " + detail, null);
    }

    public static CredentialException unsupported(String detail) {
        return new CredentialException(Kind.UNSUPPORTED_OPERATION, detail, null);
    }

    // ========== Session Errors ==========

    public static CredentialException sessionNotFound() {
        return new CredentialException(Kind.SESSION_NOT_FOUND, "No pending session for the presented state", null);
    }

    public static CredentialException sessionExpired() {
        return new CredentialException(Kind.SESSION_EXPIRED, "Authorization session has expired", null);
    }

    public static CredentialException stateMismatch() {
        return new CredentialException(Kind.STATE_MISMATCH, "Returned state does not match the session state", null);
    }

    // ========== Token Errors ==========

    public static CredentialException tokenNotFound(String keyHash) {
        return new CredentialException(Kind.TOKEN_NOT_FOUND, "No token stored for key %s".formatted(keyHash), null);
    }

    public static CredentialException noRefreshToken() {
        return new CredentialException(Kind.NO_REFRESH_TOKEN, "Token has no refresh token", null);
    }

    // ========== Token Endpoint Errors ==========

    public static CredentialException transportError(String detail, Throwable cause) {
        return new CredentialException(Kind.TRANSPORT_ERROR, "Token endpoint unreachable: " + detail, cause);
    }

    /**
     * Server returned an OAuth error response.
     *
     * @param error       OAuth {@code error} code
     * @param description OAuth {@code error_description}, may be null
     * @param httpStatus  HTTP status of the response
     * @param rawBody     unparsed response body
     * @return token endpoint problem
     */
    public static CredentialException tokenEndpointError(
            String error, String description, int httpStatus, String rawBody) {
        final var message = description != null
                ? "Token endpoint returned error '%s': %s".formatted(error, description)
                : "Token endpoint returned error '%s'".formatted(error);
        return new CredentialException(
                Kind.TOKEN_ENDPOINT_ERROR, message, null, error, description, httpStatus, rawBody);
    }

    /**
     * Server returned a response that is not a usable token response.
     */
    public static CredentialException malformedResponse(String detail, int httpStatus, String rawBody) {
        return new CredentialException(
                Kind.TOKEN_ENDPOINT_ERROR,
                "Unusable token endpoint response (HTTP %d): %s".formatted(httpStatus, detail),
                null,
                null,
                null,
                httpStatus,
                rawBody);
    }

    public static CredentialException authorizationDenied(String error, String description) {
        final var message = description != null
                ? "Authorization denied (%s): %s".formatted(error, description)
                : "Authorization denied (%s)".formatted(error);
        return new CredentialException(Kind.AUTHORIZATION_DENIED, message, null, error, description, null, null);
    }

    public static CredentialException deviceCodeExpired() {
        return new CredentialException(Kind.DEVICE_CODE_EXPIRED, "Device code expired before authorization", null);
    }

    // ========== Callback Errors ==========

    public static CredentialException callbackTimeout(Duration waited) {
        return new CredentialException(
                Kind.CALLBACK_TIMEOUT, "No authorization callback received within %s".formatted(waited), null);
    }

    // ========== Registration Errors ==========

    /**
     * Registration endpoint rejected a request or returned an unusable response.
     *
     * @param error       RFC 7591 {@code error} code, may be null
     * @param description {@code error_description}, may be null
     * @param httpStatus  HTTP status of the response
     * @param rawBody     unparsed response body
     * @return registration problem
     */
    public static CredentialException registrationFailed(
            String error, String description, int httpStatus, String rawBody) {
        final String detail;
        if (error != null) {
            detail = description != null ? error + ": " + description : error;
        } else {
            detail = description != null ? description + ", HTTP " + httpStatus : "HTTP " + httpStatus;
        }
        return new CredentialException(
                Kind.REGISTRATION_FAILED,
                "Client registration failed (%s)".formatted(detail),
                null,
                error,
                description,
                httpStatus,
                rawBody);
    }

    // ========== Coordination Errors ==========

    public static CredentialException lockTimeout(String keyHash) {
        return new CredentialException(
                Kind.LOCK_TIMEOUT, "Timed out waiting for refresh of key %s".formatted(keyHash), null);
    }

    public static CredentialException interrupted(InterruptedException cause) {
        return new CredentialException(Kind.INTERRUPTED, "Interrupted while waiting", cause);
    }

    // ========== Storage Errors ==========

    public static CredentialException storageFailure(String detail, Throwable cause) {
        return new CredentialException(Kind.STORAGE_FAILURE, "Credential storage failure: " + detail, cause);
    }
}
