package warden.core.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.model.ClientMetadata;
import warden.core.model.ClientRegistration;
import warden.core.model.OAuthConfig;
import warden.core.model.TokenEndpointRequest;
import warden.core.model.TokenEndpointResponse;
import warden.core.model.problem.CredentialException;
import warden.core.model.problem.CredentialProblem;
import warden.spi.TokenEndpointTransport;

/**
 * Dynamic client registration (RFC 7591) and registration management
 * (RFC 7592).
 *
 * <p>Management calls go to the {@code registration_client_uri} the server
 * returned, falling back to the registration endpoint, and authenticate with
 * the {@code registration_access_token}. Failures surface as
 * {@link CredentialException.Kind#REGISTRATION_FAILED} carrying the server's
 * {@code error} and raw body.
 */
public class ClientRegistrationService {

    private static final Logger LOG = Logger.getLogger(ClientRegistrationService.class);

    private final String registrationEndpoint;
    private final TokenEndpointTransport transport;
    private final WardenConfig config;
    private final ObjectMapper mapper;

    /**
     * @throws CredentialException with kind {@code INVALID_CONFIG} unless the endpoint
     *         uses https or http on a loopback host
     */
    public ClientRegistrationService(String registrationEndpoint, TokenEndpointTransport transport, WardenConfig config) {
        if (registrationEndpoint == null || registrationEndpoint.isBlank()) {
            throw CredentialProblem.invalidConfig("registration_endpoint is required");
        }
        OAuthConfig.requireSecureEndpoint(registrationEndpoint, "registration_endpoint");
        this.registrationEndpoint = registrationEndpoint;
        this.transport = transport;
        this.config = config;
        this.mapper = new ObjectMapper();
    }

    /**
     * Register a new client.
     *
     * @param metadata client metadata; at least one redirect URI is expected by most servers
     * @return issued client credentials
     */
    public ClientRegistration register(ClientMetadata metadata) {
        final var request = TokenEndpointRequest.json("POST", registrationEndpoint, toJson(metadata, null), null);
        final var registration = parse(send(request));
        LOG.infof("Registered client %s", registration.clientId());
        return registration;
    }

    /**
     * Read the current configuration of a registered client.
     *
     * @throws IllegalArgumentException if {@code registration} has no registration access token
     */
    public ClientRegistration read(ClientRegistration registration) {
        final var request = TokenEndpointRequest.json("GET", clientUri(registration), null, token(registration));
        return parse(send(request)).retainingManagementOf(registration);
    }

    /**
     * Replace the metadata of a registered client. The server may rotate the
     * client secret and the registration access token.
     */
    public ClientRegistration update(ClientRegistration registration, ClientMetadata metadata) {
        final var body = toJson(metadata, registration.clientId());
        final var request = TokenEndpointRequest.json("PUT", clientUri(registration), body, token(registration));
        final var updated = parse(send(request)).retainingManagementOf(registration);
        LOG.infof("Updated client %s", updated.clientId());
        return updated;
    }

    /**
     * Deregister a client.
     */
    public void delete(ClientRegistration registration) {
        final var request = TokenEndpointRequest.json("DELETE", clientUri(registration), null, token(registration));
        final var response = send(request);
        if (!response.isSuccess()) {
            throw failure(response);
        }
        LOG.infof("Deleted client %s", registration.clientId());
    }

    private TokenEndpointResponse send(TokenEndpointRequest request) {
        return EndpointCalls.send(transport, request, config.transport().timeout());
    }

    private String clientUri(ClientRegistration registration) {
        final var uri = registration.registrationClientUri();
        if (uri == null || uri.isBlank()) {
            return registrationEndpoint;
        }
        OAuthConfig.requireSecureEndpoint(uri, "registration_client_uri");
        return uri;
    }

    private static String token(ClientRegistration registration) {
        return registration.managementToken()
                .orElseThrow(() -> new IllegalArgumentException("registration has no registration_access_token"));
    }

    private String toJson(ClientMetadata metadata, String clientId) {
        final var node = mapper.valueToTree(metadata);
        if (clientId != null) {
            ((ObjectNode) node).put("client_id", clientId);
        }
        return node.toString();
    }

    private ClientRegistration parse(TokenEndpointResponse response) {
        if (!response.isSuccess()) {
            throw failure(response);
        }
        try {
            final var registration = mapper.readValue(response.body(), ClientRegistration.class);
            if (registration == null || registration.clientId() == null || registration.clientId().isBlank()) {
                throw CredentialProblem.registrationFailed(
                        null, "missing client_id", response.statusCode(), response.body());
            }
            return registration;
        } catch (JsonProcessingException e) {
            LOG.debugf("Unusable registration response: %s", e.getOriginalMessage());
            throw CredentialProblem.registrationFailed(
                    null, "response is not a JSON object", response.statusCode(), response.body());
        }
    }

    private CredentialException failure(TokenEndpointResponse response) {
        String error = null;
        String description = null;
        try {
            final JsonNode json = mapper.readTree(response.body());
            if (json != null && json.isObject()) {
                error = json.hasNonNull("error") ? json.get("error").asText() : null;
                description = json.hasNonNull("error_description") ? json.get("error_description").asText() : null;
            }
        } catch (JsonProcessingException e) {
            LOG.debugf("Registration error body is not JSON: %s", e.getOriginalMessage());
        }
        LOG.warnf("Registration endpoint returned HTTP %d (%s)", response.statusCode(), error);
        return CredentialProblem.registrationFailed(error, description, response.statusCode(), response.body());
    }
}
