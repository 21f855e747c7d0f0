package warden.core.service;

import java.time.Instant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import warden.core.model.DeviceAuthorization;
import warden.core.model.Token;
import warden.core.model.TokenEndpointResponse;
import warden.core.model.problem.CredentialException;
import warden.core.model.problem.CredentialProblem;

/**
 * Interprets raw OAuth endpoint responses.
 *
 * <p>A JSON body with an {@code error} member is an OAuth error response
 * regardless of HTTP status (some providers answer errors with 200). Any other
 * non-2xx status, a body that is not a JSON object, or a token response
 * without {@code access_token} is an unusable response. Both surface as
 * {@link CredentialException.Kind#TOKEN_ENDPOINT_ERROR} carrying the raw body.
 */
public class TokenResponseParser {

    private static final Logger LOG = Logger.getLogger(TokenResponseParser.class);

    private final ObjectMapper mapper;

    public TokenResponseParser() {
        this(new ObjectMapper());
    }

    public TokenResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parse a token response.
     *
     * @param response raw response
     * @param issuedAt time used to derive {@code expires_at}
     * @return the issued token
     */
    public Token parseToken(TokenEndpointResponse response, Instant issuedAt) {
        final var json = successBody(response);

        final var accessToken = text(json, "access_token");
        if (accessToken == null || accessToken.isBlank()) {
            throw CredentialProblem.malformedResponse("missing access_token", response.statusCode(), response.body());
        }

        final var expiresIn = json.hasNonNull("expires_in") ? json.get("expires_in").asLong() : null;

        LOG.debugf("Parsed token response, expires_in: %s", expiresIn);
        return Token.issued(
                accessToken,
                text(json, "refresh_token"),
                text(json, "token_type"),
                expiresIn,
                text(json, "scope"),
                text(json, "id_token"),
                issuedAt);
    }

    /**
     * Parse a device authorization response (RFC 8628, section 3.2).
     */
    public DeviceAuthorization parseDeviceAuthorization(TokenEndpointResponse response) {
        final var json = successBody(response);
        try {
            return mapper.treeToValue(json, DeviceAuthorization.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.debugf("Unusable device authorization response: %s", e.getMessage());
            throw CredentialProblem.malformedResponse(
                    "invalid device authorization response", response.statusCode(), response.body());
        }
    }

    private JsonNode successBody(TokenEndpointResponse response) {
        final var json = readObject(response.body());

        if (json != null && json.hasNonNull("error")) {
            final var error = json.get("error").asText();
            final var description = text(json, "error_description");
            LOG.debugf("Endpoint returned OAuth error %s (HTTP %d)", error, response.statusCode());
            throw CredentialProblem.tokenEndpointError(error, description, response.statusCode(), response.body());
        }
        if (!response.isSuccess()) {
            LOG.warnf("Endpoint returned HTTP %d without an OAuth error", response.statusCode());
            throw CredentialProblem.malformedResponse(
                    "unexpected HTTP status", response.statusCode(), response.body());
        }
        if (json == null) {
            throw CredentialProblem.malformedResponse(
                    "body is not a JSON object", response.statusCode(), response.body());
        }
        return json;
    }

    private JsonNode readObject(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            final var node = mapper.readTree(body);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            LOG.debugf("Response body is not JSON: %s", e.getOriginalMessage());
            return null;
        }
    }

    private static String text(JsonNode json, String field) {
        final var node = json.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
