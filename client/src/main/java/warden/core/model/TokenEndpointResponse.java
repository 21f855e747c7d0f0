package warden.core.model;

/**
 * Raw response from an OAuth endpoint.
 *
 * @param statusCode HTTP status
 * @param body       response body, may be empty
 */
public record TokenEndpointResponse(int statusCode, String body) {

    public TokenEndpointResponse {
        if (body == null) {
            body = "";
        }
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
