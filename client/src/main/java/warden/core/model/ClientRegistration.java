package warden.core.model;

import java.time.Instant;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Client information returned by a registration endpoint (RFC 7591,
 * section 3.2.1), including the RFC 7592 management credentials.
 *
 * @param clientId                issued client identifier
 * @param clientSecret            issued secret, null for public clients
 * @param clientIdIssuedAt        issue time in epoch seconds, may be null
 * @param clientSecretExpiresAt   secret expiry in epoch seconds, 0 for never, may be null
 * @param registrationAccessToken bearer token for reading, updating and deleting the registration
 * @param registrationClientUri   URL of the registration, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientRegistration(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_secret") String clientSecret,
        @JsonProperty("client_id_issued_at") Long clientIdIssuedAt,
        @JsonProperty("client_secret_expires_at") Long clientSecretExpiresAt,
        @JsonProperty("registration_access_token") String registrationAccessToken,
        @JsonProperty("registration_client_uri") String registrationClientUri) {

    public Optional<String> managementToken() {
        return Optional.ofNullable(registrationAccessToken).filter(s -> !s.isBlank());
    }

    public boolean isSecretExpired(Instant now) {
        return clientSecretExpiresAt != null
                && clientSecretExpiresAt != 0
                && now.getEpochSecond() >= clientSecretExpiresAt;
    }

    /**
     * Copy {@code config} with this registration's client id and secret.
     */
    public OAuthConfig applyTo(OAuthConfig config) {
        return config.withClient(clientId, clientSecret);
    }

    /**
     * Keep the management token and URI of {@code previous} where this
     * response omits them. RFC 7592 servers may leave them out of read and
     * update responses.
     */
    public ClientRegistration retainingManagementOf(ClientRegistration previous) {
        return new ClientRegistration(
                clientId,
                clientSecret,
                clientIdIssuedAt,
                clientSecretExpiresAt,
                registrationAccessToken != null ? registrationAccessToken : previous.registrationAccessToken(),
                registrationClientUri != null ? registrationClientUri : previous.registrationClientUri());
    }

    @JsonIgnore
    public boolean isConfidential() {
        return clientSecret != null && !clientSecret.isEmpty();
    }

    @Override
    public String toString() {
        return "ClientRegistration[clientId=" + clientId + ", clientSecret="
                + (clientSecret != null ? "<redacted>" : "null") + ", registrationClientUri="
                + registrationClientUri + "]";
    }
}
