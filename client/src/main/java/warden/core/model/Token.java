package warden.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalDouble;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An issued OAuth2 credential.
 *
 * <p>{@code expiresAt} is computed once, when the token is issued or refreshed,
 * as issuance time plus {@code expiresIn}. A token without {@code expiresAt}
 * never expires from the client's point of view.
 *
 * @param accessToken  bearer credential presented to resource servers
 * @param refreshToken credential used to obtain a new access token, may be null
 * @param tokenType    token type, typically {@code Bearer}
 * @param expiresIn    lifetime in seconds as reported by the server, may be null
 * @param expiresAt    absolute expiration in epoch seconds, may be null
 * @param scope        granted scope, may be null
 * @param idToken      OpenID Connect ID token, stored opaquely, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Token(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") Long expiresIn,
        @JsonProperty("expires_at") Long expiresAt,
        @JsonProperty("scope") String scope,
        @JsonProperty("id_token") String idToken) {

    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public Token {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken must not be null or blank");
        }
        if (tokenType == null || tokenType.isBlank()) {
            tokenType = DEFAULT_TOKEN_TYPE;
        }
    }

    /**
     * Create a token whose absolute expiration is derived from {@code expiresIn}.
     */
    public static Token issued(
            String accessToken,
            String refreshToken,
            String tokenType,
            Long expiresIn,
            String scope,
            String idToken,
            Instant issuedAt) {
        final var expiresAt = expiresIn != null ? issuedAt.getEpochSecond() + expiresIn : null;
        return new Token(accessToken, refreshToken, tokenType, expiresIn, expiresAt, scope, idToken);
    }

    @JsonIgnore
    public boolean isExpired() {
        return isExpired(Instant.now());
    }

    /**
     * A token is expired once {@code now >= expiresAt}. Tokens without an
     * absolute expiration are never expired.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.getEpochSecond() >= expiresAt;
    }

    public boolean expiresWithin(Duration window, Instant now) {
        return expiresAt != null && now.plus(window).getEpochSecond() >= expiresAt;
    }

    @JsonIgnore
    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    /**
     * Fraction of the token's lifetime that has elapsed at {@code now},
     * clamped to {@code [0, 1]}.
     *
     * @return the fraction, or empty when the lifetime is unknown
     */
    public OptionalDouble elapsedLifetimeFraction(Instant now) {
        if (expiresAt == null || expiresIn == null || expiresIn <= 0) {
            return OptionalDouble.empty();
        }
        final var remaining = expiresAt - now.getEpochSecond();
        final var elapsed = (double) (expiresIn - remaining) / expiresIn;
        return OptionalDouble.of(Math.max(0.0, Math.min(1.0, elapsed)));
    }

    /**
     * Return this token, or a copy carrying {@code previousRefreshToken}
     * when this token has none.
     */
    public Token withRefreshTokenFallback(String previousRefreshToken) {
        if (hasRefreshToken() || previousRefreshToken == null) {
            return this;
        }
        return new Token(accessToken, previousRefreshToken, tokenType, expiresIn, expiresAt, scope, idToken);
    }

    @Override
    public String toString() {
        return "Token[tokenType=" + tokenType + ", expiresAt=" + expiresAt + ", scope=" + scope
                + ", hasRefreshToken=" + hasRefreshToken() + "]";
    }
}
