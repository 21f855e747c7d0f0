package warden.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import warden.core.util.FormEncoding;

/**
 * Outbound request to an authorization server endpoint.
 *
 * @param method  HTTP method
 * @param url     absolute endpoint URL
 * @param form    form parameters in the order they are sent
 * @param headers request headers
 * @param body    raw body sent instead of the encoded form, null for form requests
 */
public record TokenEndpointRequest(
        String method, String url, Map<String, String> form, Map<String, String> headers, String body) {

    public static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";
    public static final String JSON_CONTENT_TYPE = "application/json";

    public TokenEndpointRequest {
        form = Collections.unmodifiableMap(new LinkedHashMap<>(form));
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * Form POST accepting a JSON response.
     */
    public static TokenEndpointRequest formPost(String url, Map<String, String> form) {
        final var headers = new LinkedHashMap<String, String>();
        headers.put("Content-Type", FORM_CONTENT_TYPE);
        headers.put("Accept", JSON_CONTENT_TYPE);
        return new TokenEndpointRequest("POST", url, form, headers, null);
    }

    /**
     * JSON request, optionally authorized with a bearer token.
     *
     * @param json request body, or null for a request without body
     */
    public static TokenEndpointRequest json(String method, String url, String json, String bearerToken) {
        final var headers = new LinkedHashMap<String, String>();
        if (bearerToken != null) {
            headers.put("Authorization", "Bearer " + bearerToken);
        }
        if (json != null) {
            headers.put("Content-Type", JSON_CONTENT_TYPE);
        }
        headers.put("Accept", JSON_CONTENT_TYPE);
        return new TokenEndpointRequest(method, url, Map.of(), headers, json != null ? json : "");
    }

    public String encodedBody() {
        return body != null ? body : FormEncoding.encode(form);
    }

    @Override
    public String toString() {
        return "TokenEndpointRequest[" + method + " " + url + ", params=" + form.keySet() + "]";
    }
}
