package warden.core.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Optional;

import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.model.AuthFlowResult;
import warden.core.model.CallbackResult;
import warden.core.model.DeviceAuthorization;
import warden.core.model.OAuthConfig;
import warden.core.model.Session;
import warden.core.model.Token;
import warden.core.model.TokenEndpointRequest;
import warden.core.model.TokenEndpointResponse;
import warden.core.model.problem.CredentialException;
import warden.core.model.problem.CredentialProblem;
import warden.core.port.out.CredentialStorage;
import warden.core.util.FormEncoding;
import warden.core.util.SecureHash;
import warden.spi.TokenEndpointTransport;

/**
 * OAuth 2.0 client flows: authorization code with PKCE (RFC 6749, RFC 7636),
 * refresh (RFC 6749 section 6) and device authorization (RFC 8628).
 *
 * <p>Stateless apart from its collaborators. Pending sessions and issued
 * tokens live in {@link CredentialStorage}. This class performs no refresh
 * coordination; concurrent callers should go through {@link TokenRefresher}.
 */
public class OAuthFlowClient {

    private static final Logger LOG = Logger.getLogger(OAuthFlowClient.class);

    static final String DEVICE_CODE_GRANT = "urn:ietf:params:oauth:grant-type:device_code";
    private static final Duration SLOW_DOWN_INCREMENT = Duration.ofSeconds(5);

    /**
     * Pause between device-flow polls.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final OAuthConfig oauthConfig;
    private final CredentialStorage storage;
    private final TokenEndpointTransport transport;
    private final WardenConfig config;
    private final PkceGenerator pkce;
    private final TokenResponseParser parser;
    private final Clock clock;
    private final Sleeper sleeper;

    public OAuthFlowClient(
            OAuthConfig oauthConfig, CredentialStorage storage, TokenEndpointTransport transport, WardenConfig config) {
        this(
                oauthConfig,
                storage,
                transport,
                config,
                new PkceGenerator(),
                Clock.systemUTC(),
                duration -> Thread.sleep(duration.toMillis()));
    }

    OAuthFlowClient(
            OAuthConfig oauthConfig,
            CredentialStorage storage,
            TokenEndpointTransport transport,
            WardenConfig config,
            PkceGenerator pkce,
            Clock clock,
            Sleeper sleeper) {
        this.oauthConfig = oauthConfig;
        this.storage = storage;
        this.transport = transport;
        this.config = config;
        this.pkce = pkce;
        this.parser = new TokenResponseParser();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public OAuthConfig oauthConfig() {
        return oauthConfig;
    }

    public CredentialStorage storage() {
        return storage;
    }

    Clock clock() {
        return clock;
    }

    // ========== Authorization Code Flow ==========

    /**
     * Begin an authorization-code flow with PKCE.
     *
     * <p>Stores a {@link Session} keyed by the generated state. The caller
     * sends the user to the returned URL and later passes the callback's
     * {@code state} and {@code code} to {@link #exchangeCode}.
     *
     * @return authorization URL and state
     * @throws CredentialException with kind {@code INVALID_CONFIG}
     */
    public AuthFlowResult startAuthFlow() {
        oauthConfig.validate();

        final var state = pkce.generateState();
        final var verifier = pkce.generateCodeVerifier();
        final var challenge = pkce.generateChallenge(verifier);

        final var params = new LinkedHashMap<String, String>();
        params.put("response_type", "code");
        params.put("client_id", oauthConfig.clientId());
        params.put("redirect_uri", oauthConfig.redirectUri());
        oauthConfig.scopeValue().ifPresent(scope -> params.put("scope", scope));
        params.put("state", state);
        params.put("code_challenge", challenge);
        params.put("code_challenge_method", PkceGenerator.S256_METHOD);

        final var endpoint = oauthConfig.authorizationEndpoint();
        final var separator = endpoint.contains("?") ? "&" : "?";
        final var url = endpoint + separator + FormEncoding.encode(params);

        storage.saveSession(state, Session.create(state, verifier, clock.instant()));
        LOG.debugf("Started authorization flow for client %s", oauthConfig.clientId());
        return new AuthFlowResult(url, state);
    }

    /**
     * Exchange an authorization code and store the resulting token.
     *
     * <p>The pending session is consumed before the token endpoint is called,
     * so a state value can be redeemed at most once even if the exchange fails.
     * The state recorded inside the consumed session must equal {@code state};
     * a record filed under another key is rejected with {@code STATE_MISMATCH}.
     *
     * @param state state returned on the callback
     * @param code  authorization code returned on the callback
     * @param key   storage key for the issued token
     * @return the issued token
     * @throws CredentialException with kind {@code SESSION_NOT_FOUND}, {@code STATE_MISMATCH},
     *         {@code SESSION_EXPIRED}, {@code TRANSPORT_ERROR} or {@code TOKEN_ENDPOINT_ERROR}
     */
    public Token exchangeCode(String state, String code, String key) {
        requireNonBlank(state, "state");
        requireNonBlank(code, "code");
        requireNonBlank(key, "key");

        final var session = storage.consumeSession(state).orElseThrow(CredentialProblem::sessionNotFound);
        if (!constantTimeEquals(session.state(), state)) {
            throw CredentialProblem.stateMismatch();
        }
        if (session.isOlderThan(config.session().maxAge(), clock.instant())) {
            LOG.debugf("Rejecting callback for session older than %s", config.session().maxAge());
            throw CredentialProblem.sessionExpired();
        }

        final var form = new LinkedHashMap<String, String>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("redirect_uri", oauthConfig.redirectUri());
        form.put("client_id", oauthConfig.clientId());
        form.put("code_verifier", session.codeVerifier());
        oauthConfig.clientSecretValue().ifPresent(secret -> form.put("client_secret", secret));

        final var response = send(TokenEndpointRequest.formPost(oauthConfig.tokenEndpoint(), form));
        final var token = parser.parseToken(response, clock.instant());
        storage.saveToken(key, token);

        LOG.infof("Authorization code exchanged for key %s", SecureHash.forLog(key));
        return token;
    }

    /**
     * Complete a flow from the full redirect URI the browser was sent to.
     *
     * @param expectedState state returned by {@link #startAuthFlow()}
     * @param callbackUri   redirect URI including its query string
     * @param key           storage key for the issued token
     * @return the issued token
     * @throws IllegalArgumentException if the URI is malformed
     * @see #completeAuthorization(String, CallbackResult, String)
     */
    public Token completeAuthorization(String expectedState, String callbackUri, String key) {
        return completeAuthorization(expectedState, CallbackResult.fromUri(callbackUri), key);
    }

    /**
     * Complete a flow from parsed callback parameters.
     *
     * <p>The returned state is checked before anything else, so a callback
     * forged without the flow's state fails with {@code STATE_MISMATCH} and
     * leaves the pending session in place. A genuine error callback consumes
     * the session before reporting the denial.
     *
     * @param expectedState state returned by {@link #startAuthFlow()}
     * @param callback      parameters of the redirect
     * @param key           storage key for the issued token
     * @return the issued token
     * @throws CredentialException with kind {@code STATE_MISMATCH}, {@code AUTHORIZATION_DENIED}
     *         when the server reported an error, or any failure of {@link #exchangeCode}
     * @throws IllegalArgumentException if an argument is blank or the callback carries no code
     */
    public Token completeAuthorization(String expectedState, CallbackResult callback, String key) {
        requireNonBlank(expectedState, "expectedState");
        requireNonBlank(key, "key");

        final var state = callback.state();
        if (state == null || !constantTimeEquals(state, expectedState)) {
            throw CredentialProblem.stateMismatch();
        }

        if (callback.isError()) {
            storage.consumeSession(state);
            throw CredentialProblem.authorizationDenied(callback.error(), callback.errorDescription());
        }
        if (!callback.isSuccess()) {
            throw new IllegalArgumentException("callback has no authorization code");
        }
        return exchangeCode(state, callback.code(), key);
    }

    // ========== Refresh ==========

    /**
     * Obtain a new access token using the token's refresh token.
     *
     * <p>Does not store the result. When the server omits a new refresh token,
     * the previous one is carried forward.
     *
     * @param token current token
     * @return the refreshed token
     * @throws CredentialException with kind {@code NO_REFRESH_TOKEN},
     *         {@code TRANSPORT_ERROR} or {@code TOKEN_ENDPOINT_ERROR}
     */
    public Token refresh(Token token) {
        if (!token.hasRefreshToken()) {
            throw CredentialProblem.noRefreshToken();
        }

        final var form = new LinkedHashMap<String, String>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", token.refreshToken());
        form.put("client_id", oauthConfig.clientId());
        oauthConfig.clientSecretValue().ifPresent(secret -> form.put("client_secret", secret));

        final var response = send(TokenEndpointRequest.formPost(oauthConfig.tokenEndpoint(), form));
        return parser.parseToken(response, clock.instant()).withRefreshTokenFallback(token.refreshToken());
    }

    // ========== Device Authorization Flow ==========

    /**
     * Request a device code (RFC 8628, section 3.1).
     *
     * @return codes and verification URI to show the user
     * @throws CredentialException with kind {@code UNSUPPORTED_OPERATION} when no
     *         device authorization endpoint is configured
     */
    public DeviceAuthorization requestDeviceAuthorization() {
        final var endpoint = oauthConfig.deviceEndpoint()
                .orElseThrow(() -> CredentialProblem.unsupported("No device authorization endpoint configured"));
        oauthConfig.validate();

        final var form = new LinkedHashMap<String, String>();
        form.put("client_id", oauthConfig.clientId());
        oauthConfig.scopeValue().ifPresent(scope -> form.put("scope", scope));

        final var authorization = parser.parseDeviceAuthorization(send(TokenEndpointRequest.formPost(endpoint, form)));
        LOG.debugf("Device authorization issued, polling every %ds", authorization.interval());
        return authorization;
    }

    /**
     * Poll the token endpoint until the user approves or denies the device
     * (RFC 8628, section 3.4), then store the token under {@code key}.
     *
     * @throws CredentialException with kind {@code AUTHORIZATION_DENIED},
     *         {@code DEVICE_CODE_EXPIRED}, {@code INTERRUPTED} or any token endpoint failure
     */
    public Token pollDeviceToken(DeviceAuthorization authorization, String key) {
        requireNonBlank(key, "key");

        final var minInterval = config.device().minPollInterval();
        var interval = authorization.pollInterval().compareTo(minInterval) < 0
                ? minInterval
                : authorization.pollInterval();
        final var deadline = clock.instant().plusSeconds(authorization.expiresIn());

        final var form = new LinkedHashMap<String, String>();
        form.put("grant_type", DEVICE_CODE_GRANT);
        form.put("device_code", authorization.deviceCode());
        form.put("client_id", oauthConfig.clientId());
        oauthConfig.clientSecretValue().ifPresent(secret -> form.put("client_secret", secret));
        final var request = TokenEndpointRequest.formPost(oauthConfig.tokenEndpoint(), form);

        while (true) {
            if (!clock.instant().isBefore(deadline)) {
                throw CredentialProblem.deviceCodeExpired();
            }
            pause(interval);

            try {
                final var token = parser.parseToken(send(request), clock.instant());
                storage.saveToken(key, token);
                LOG.infof("Device authorization completed for key %s", SecureHash.forLog(key));
                return token;
            } catch (CredentialException e) {
                final var error = e.kind() == CredentialException.Kind.TOKEN_ENDPOINT_ERROR
                        ? e.serverError().orElse("")
                        : "";
                switch (error) {
                    case "authorization_pending" -> LOG.debug("Device authorization pending");
                    case "slow_down" -> {
                        interval = interval.plus(SLOW_DOWN_INCREMENT);
                        LOG.debugf("Server requested slow down, polling every %ds", interval.toSeconds());
                    }
                    case "access_denied" -> throw CredentialProblem.authorizationDenied(
                            error, e.serverErrorDescription().orElse(null));
                    case "expired_token" -> throw CredentialProblem.deviceCodeExpired();
                    default -> throw e;
                }
            }
        }
    }

    // ========== Token Convenience ==========

    public void saveToken(String key, Token token) {
        storage.saveToken(key, token);
    }

    public Optional<Token> getToken(String key) {
        return storage.getToken(key);
    }

    public void deleteToken(String key) {
        storage.deleteToken(key);
    }

    // ========== Internals ==========

    private TokenEndpointResponse send(TokenEndpointRequest request) {
        return EndpointCalls.send(transport, request, config.transport().timeout());
    }

    private void pause(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CredentialProblem.interrupted(e);
        }
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }
}
