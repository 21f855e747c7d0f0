package warden.core.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;
import java.util.Set;

import warden.core.model.problem.CredentialProblem;

/**
 * Static client registration and endpoint configuration.
 *
 * <p>Immutable and safe to share across threads.
 *
 * @param clientId                    OAuth client identifier
 * @param clientSecret                client secret for confidential clients, may be null
 * @param authorizationEndpoint       authorization endpoint URL
 * @param tokenEndpoint               token endpoint URL
 * @param redirectUri                 registered redirect URI
 * @param scope                       requested scope, may be null
 * @param deviceAuthorizationEndpoint RFC 8628 device authorization endpoint, may be null
 */
public record OAuthConfig(
        String clientId,
        String clientSecret,
        String authorizationEndpoint,
        String tokenEndpoint,
        String redirectUri,
        String scope,
        String deviceAuthorizationEndpoint) {

    public static final String LOOPBACK_REDIRECT_URI = "http://127.0.0.1/callback";

    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "[::1]", "::1");
    private static final Set<String> MICROSOFT_TENANTS = Set.of("common", "organizations", "consumers");

    public static OAuthConfig of(
            String clientId, String authorizationEndpoint, String tokenEndpoint, String redirectUri, String scope) {
        return new OAuthConfig(clientId, null, authorizationEndpoint, tokenEndpoint, redirectUri, scope, null);
    }

    public Optional<String> clientSecretValue() {
        return Optional.ofNullable(clientSecret).filter(s -> !s.isBlank());
    }

    public Optional<String> scopeValue() {
        return Optional.ofNullable(scope).filter(s -> !s.isBlank());
    }

    public Optional<String> deviceEndpoint() {
        return Optional.ofNullable(deviceAuthorizationEndpoint).filter(s -> !s.isBlank());
    }

    public OAuthConfig withClientSecret(String secret) {
        return new OAuthConfig(
                clientId, secret, authorizationEndpoint, tokenEndpoint, redirectUri, scope, deviceAuthorizationEndpoint);
    }

    /**
     * Copy with the client credentials issued by dynamic registration.
     */
    public OAuthConfig withClient(String id, String secret) {
        return new OAuthConfig(
                id, secret, authorizationEndpoint, tokenEndpoint, redirectUri, scope, deviceAuthorizationEndpoint);
    }

    public OAuthConfig withRedirectUri(String uri) {
        return new OAuthConfig(
                clientId, clientSecret, authorizationEndpoint, tokenEndpoint, uri, scope, deviceAuthorizationEndpoint);
    }

    /**
     * Validate required fields and endpoint transport security.
     *
     * <p>Endpoints must use {@code https}, except plain {@code http} on a
     * loopback host.
     *
     * @throws warden.core.model.problem.CredentialException with kind {@code INVALID_CONFIG}
     */
    public void validate() {
        requireNonBlank(clientId, "client_id");
        requireNonBlank(authorizationEndpoint, "authorization_endpoint");
        requireNonBlank(tokenEndpoint, "token_endpoint");
        requireNonBlank(redirectUri, "redirect_uri");
        requireSecureEndpoint(authorizationEndpoint, "authorization_endpoint");
        requireSecureEndpoint(tokenEndpoint, "token_endpoint");
        deviceEndpoint().ifPresent(endpoint -> requireSecureEndpoint(endpoint, "device_authorization_endpoint"));
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw CredentialProblem.invalidConfig(name + " is required");
        }
    }

    /**
     * Require {@code url} to be an https URL, or http on a loopback host.
     *
     * @param url  endpoint URL
     * @param name field name used in the error message
     * @throws warden.core.model.problem.CredentialException with kind {@code INVALID_CONFIG}
     */
    public static void requireSecureEndpoint(String url, String name) {
        final URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw CredentialProblem.invalidConfig("%s is not a valid URL".formatted(name));
        }
        final var scheme = uri.getScheme();
        final var host = uri.getHost();
        if ("https".equalsIgnoreCase(scheme) && host != null) {
            return;
        }
        if ("http".equalsIgnoreCase(scheme) && host != null && LOOPBACK_HOSTS.contains(host.toLowerCase())) {
            return;
        }
        throw CredentialProblem.invalidConfig("%s must use https (or http on a loopback host)".formatted(name));
    }

    // ========== Provider Presets ==========

    public static OAuthConfig github(String clientId, String scope) {
        return new OAuthConfig(
                clientId,
                null,
                "https://github.com/login/oauth/authorize",
                "https://github.com/login/oauth/access_token",
                LOOPBACK_REDIRECT_URI,
                scope,
                "https://github.com/login/device/code");
    }

    public static OAuthConfig google(String clientId, String scope) {
        return new OAuthConfig(
                clientId,
                null,
                "https://accounts.google.com/o/oauth2/v2/auth",
                "https://oauth2.googleapis.com/token",
                LOOPBACK_REDIRECT_URI,
                scope,
                "https://oauth2.googleapis.com/device/code");
    }

    /**
     * Microsoft identity platform. Tenants other than {@code common},
     * {@code organizations} and {@code consumers} resolve to {@code common}.
     */
    public static OAuthConfig microsoft(String clientId, String tenant, String scope) {
        final var resolved = tenant != null && MICROSOFT_TENANTS.contains(tenant) ? tenant : "common";
        final var base = "https://login.microsoftonline.com/" + resolved + "/oauth2/v2.0";
        return new OAuthConfig(
                clientId,
                null,
                base + "/authorize",
                base + "/token",
                LOOPBACK_REDIRECT_URI,
                scope,
                base + "/devicecode");
    }

    public static OAuthConfig gitlab(String clientId, String scope) {
        return gitlabSelfHosted(clientId, "https://gitlab.com", scope);
    }

    /**
     * Self-hosted GitLab instance rooted at {@code baseUrl}.
     *
     * @throws warden.core.model.problem.CredentialException if {@code baseUrl} is not secure
     */
    public static OAuthConfig gitlabSelfHosted(String clientId, String baseUrl, String scope) {
        requireNonBlank(baseUrl, "base_url");
        requireSecureEndpoint(baseUrl, "base_url");
        final var base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return new OAuthConfig(
                clientId, null, base + "/oauth/authorize", base + "/oauth/token", LOOPBACK_REDIRECT_URI, scope, null);
    }

    public static OAuthConfig tuist(String clientId, String scope) {
        return new OAuthConfig(
                clientId,
                null,
                "https://cloud.tuist.io/oauth/authorize",
                "https://cloud.tuist.io/oauth/token",
                LOOPBACK_REDIRECT_URI,
                scope,
                "https://cloud.tuist.io/oauth/device/code");
    }

    @Override
    public String toString() {
        return "OAuthConfig[clientId=" + clientId + ", tokenEndpoint=" + tokenEndpoint + ", scope=" + scope + "]";
    }
}
