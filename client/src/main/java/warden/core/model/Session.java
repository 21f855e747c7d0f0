package warden.core.model;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pending authorization-code flow awaiting its callback.
 *
 * <p>Keyed in storage by {@code state} and consumed exactly once when the
 * authorization code is exchanged.
 *
 * @param state        opaque anti-CSRF value sent to the authorization endpoint
 * @param codeVerifier PKCE code verifier (RFC 7636)
 * @param createdAt    creation time in epoch seconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Session(
        @JsonProperty("state") String state,
        @JsonProperty("code_verifier") String codeVerifier,
        @JsonProperty("created_at") long createdAt) {

    public Session {
        if (state == null || state.isBlank()) {
            throw new IllegalArgumentException("state must not be null or blank");
        }
        if (codeVerifier == null || codeVerifier.isBlank()) {
            throw new IllegalArgumentException("codeVerifier must not be null or blank");
        }
    }

    public static Session create(String state, String codeVerifier, Instant now) {
        return new Session(state, codeVerifier, now.getEpochSecond());
    }

    /**
     * Check whether the session has outlived the given maximum age.
     *
     * @param maxAge maximum session age
     * @param now    reference time
     * @return true if more than {@code maxAge} has passed since creation
     */
    public boolean isOlderThan(Duration maxAge, Instant now) {
        return now.getEpochSecond() - createdAt > maxAge.toSeconds();
    }
}
