package warden.core.model;

import java.net.URI;
import java.net.URISyntaxException;

import warden.core.util.FormEncoding;

/**
 * Query parameters of an authorization redirect (RFC 6749, section 4.1.2).
 *
 * @param code             authorization code, null when absent or empty
 * @param state            returned state, null when absent
 * @param error            OAuth error code when the request was refused
 * @param errorDescription human-readable error description, may be null
 */
public record CallbackResult(String code, String state, String error, String errorDescription) {

    public CallbackResult {
        code = emptyToNull(code);
        error = emptyToNull(error);
    }

    /**
     * Parse a raw (still percent-encoded) query string.
     */
    public static CallbackResult fromQuery(String rawQuery) {
        final var params = FormEncoding.parseQuery(rawQuery);
        return new CallbackResult(
                params.get("code"), params.get("state"), params.get("error"), params.get("error_description"));
    }

    /**
     * Parse the query of a full redirect URI.
     *
     * @throws IllegalArgumentException if {@code callbackUri} is not a valid URI
     */
    public static CallbackResult fromUri(String callbackUri) {
        if (callbackUri == null) {
            throw new IllegalArgumentException("callbackUri must not be null");
        }
        try {
            return fromQuery(new URI(callbackUri).getRawQuery());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("callbackUri is not a valid URI", e);
        }
    }

    public boolean isSuccess() {
        return code != null && error == null;
    }

    public boolean isError() {
        return error != null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    @Override
    public String toString() {
        return "CallbackResult[code=" + (code != null ? "<redacted>" : "null") + ", state=" + state + ", error="
                + error + "]";
    }
}
