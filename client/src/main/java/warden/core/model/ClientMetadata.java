package warden.core.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Client metadata sent to a registration endpoint (RFC 7591, section 2).
 *
 * <p>Absent values and empty lists are left out of the JSON document.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientMetadata(
        @JsonProperty("redirect_uris") List<String> redirectUris,
        @JsonProperty("client_name") String clientName,
        @JsonProperty("client_uri") String clientUri,
        @JsonProperty("logo_uri") String logoUri,
        @JsonProperty("grant_types") List<String> grantTypes,
        @JsonProperty("response_types") List<String> responseTypes,
        @JsonProperty("scope") String scope,
        @JsonProperty("contacts") List<String> contacts,
        @JsonProperty("tos_uri") String tosUri,
        @JsonProperty("policy_uri") String policyUri,
        @JsonProperty("jwks_uri") String jwksUri,
        @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
        @JsonProperty("software_id") String softwareId,
        @JsonProperty("software_version") String softwareVersion) {

    public ClientMetadata {
        redirectUris = redirectUris != null ? List.copyOf(redirectUris) : List.of();
        grantTypes = grantTypes != null ? List.copyOf(grantTypes) : List.of();
        responseTypes = responseTypes != null ? List.copyOf(responseTypes) : List.of();
        contacts = contacts != null ? List.copyOf(contacts) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Metadata for a native application using the authorization-code flow
     * with PKCE and refresh tokens, without a client secret (RFC 8252).
     */
    public static ClientMetadata nativeApp(String clientName, String redirectUri) {
        return builder()
                .clientName(clientName)
                .redirectUri(redirectUri)
                .grantTypes(List.of("authorization_code", "refresh_token"))
                .responseTypes(List.of("code"))
                .tokenEndpointAuthMethod("none")
                .build();
    }

    public static final class Builder {
        private final List<String> redirectUris = new ArrayList<>();
        private String clientName;
        private String clientUri;
        private String logoUri;
        private List<String> grantTypes = List.of();
        private List<String> responseTypes = List.of();
        private String scope;
        private final List<String> contacts = new ArrayList<>();
        private String tosUri;
        private String policyUri;
        private String jwksUri;
        private String tokenEndpointAuthMethod;
        private String softwareId;
        private String softwareVersion;

        private Builder() {}

        public Builder redirectUri(String uri) {
            this.redirectUris.add(uri);
            return this;
        }

        public Builder clientName(String value) {
            this.clientName = value;
            return this;
        }

        public Builder clientUri(String value) {
            this.clientUri = value;
            return this;
        }

        public Builder logoUri(String value) {
            this.logoUri = value;
            return this;
        }

        public Builder grantTypes(List<String> value) {
            this.grantTypes = value;
            return this;
        }

        public Builder responseTypes(List<String> value) {
            this.responseTypes = value;
            return this;
        }

        public Builder scope(String value) {
            this.scope = value;
            return this;
        }

        public Builder contact(String email) {
            this.contacts.add(email);
            return this;
        }

        public Builder tosUri(String value) {
            this.tosUri = value;
            return this;
        }

        public Builder policyUri(String value) {
            this.policyUri = value;
            return this;
        }

        public Builder jwksUri(String value) {
            this.jwksUri = value;
            return this;
        }

        public Builder tokenEndpointAuthMethod(String value) {
            this.tokenEndpointAuthMethod = value;
            return this;
        }

        public Builder software(String id, String version) {
            this.softwareId = id;
            this.softwareVersion = version;
            return this;
        }

        public ClientMetadata build() {
            return new ClientMetadata(
                    redirectUris,
                    clientName,
                    clientUri,
                    logoUri,
                    grantTypes,
                    responseTypes,
                    scope,
                    contacts,
                    tosUri,
                    policyUri,
                    jwksUri,
                    tokenEndpointAuthMethod,
                    softwareId,
                    softwareVersion);
        }
    }
}
