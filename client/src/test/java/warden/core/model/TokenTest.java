package warden.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Token")
class TokenTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    private static Token expiringAt(Long expiresAt, Long expiresIn) {
        return new Token("access", "refresh", "Bearer", expiresIn, expiresAt, null, null);
    }

    @Nested
    @DisplayName("isExpired()")
    class IsExpired {

        @Test
        @DisplayName("should never expire without expires_at")
        void noExpiresAt() {
            assertFalse(expiringAt(null, 3600L).isExpired(NOW));
            assertFalse(expiringAt(null, null).isExpired());
        }

        @Test
        @DisplayName("should be expired exactly at expires_at")
        void boundary() {
            final var token = expiringAt(NOW.getEpochSecond(), 3600L);

            assertTrue(token.isExpired(NOW));
            assertFalse(token.isExpired(NOW.minusSeconds(1)));
        }

        @Test
        @DisplayName("should be expired after expires_at")
        void afterExpiry() {
            assertTrue(expiringAt(NOW.getEpochSecond() - 10, 3600L).isExpired(NOW));
        }

        @Test
        @DisplayName("should use the current time without an argument")
        void currentTime() {
            final var past = Instant.now().minusSeconds(5).getEpochSecond();
            final var future = Instant.now().plusSeconds(600).getEpochSecond();

            assertTrue(expiringAt(past, 60L).isExpired());
            assertFalse(expiringAt(future, 600L).isExpired());
        }
    }

    @Nested
    @DisplayName("issued()")
    class Issued {

        @Test
        @DisplayName("should compute expires_at from expires_in")
        void computesExpiresAt() {
            final var token = Token.issued("a", null, null, 3600L, null, null, NOW);

            assertEquals(NOW.getEpochSecond() + 3600, token.expiresAt());
            assertEquals("Bearer", token.tokenType());
        }

        @Test
        @DisplayName("should leave expires_at absent without expires_in")
        void noExpiresIn() {
            assertNull(Token.issued("a", null, "Bearer", null, null, null, NOW).expiresAt());
        }

        @Test
        @DisplayName("should reject a blank access token")
        void blankAccessToken() {
            assertThrows(IllegalArgumentException.class, () -> Token.issued(" ", null, null, 60L, null, null, NOW));
        }
    }

    @Nested
    @DisplayName("elapsedLifetimeFraction()")
    class ElapsedFraction {

        @Test
        @DisplayName("should report the elapsed share of the lifetime")
        void fraction() {
            final var token = expiringAt(NOW.getEpochSecond() + 10, 100L);

            assertEquals(0.9, token.elapsedLifetimeFraction(NOW).getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("should clamp to one after expiry")
        void clampHigh() {
            final var token = expiringAt(NOW.getEpochSecond() - 50, 100L);

            assertEquals(1.0, token.elapsedLifetimeFraction(NOW).getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("should clamp to zero when issued in the future")
        void clampLow() {
            final var token = expiringAt(NOW.getEpochSecond() + 500, 100L);

            assertEquals(0.0, token.elapsedLifetimeFraction(NOW).getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("should be empty when the lifetime is unknown")
        void unknown() {
            assertTrue(expiringAt(NOW.getEpochSecond(), null).elapsedLifetimeFraction(NOW).isEmpty());
            assertTrue(expiringAt(null, 100L).elapsedLifetimeFraction(NOW).isEmpty());
            assertTrue(expiringAt(NOW.getEpochSecond(), 0L).elapsedLifetimeFraction(NOW).isEmpty());
        }
    }

    @Test
    @DisplayName("expiresWithin() should include the window boundary")
    void expiresWithin() {
        final var token = expiringAt(NOW.getEpochSecond() + 60, 3600L);

        assertTrue(token.expiresWithin(Duration.ofSeconds(60), NOW));
        assertFalse(token.expiresWithin(Duration.ofSeconds(59), NOW));
        assertFalse(expiringAt(null, null).expiresWithin(Duration.ofDays(365), NOW));
    }

    @Nested
    @DisplayName("withRefreshTokenFallback()")
    class RefreshTokenFallback {

        @Test
        @DisplayName("should carry the previous refresh token when none was issued")
        void carriesForward() {
            final var token = new Token("a", null, "Bearer", 60L, 100L, null, null);

            assertEquals("old", token.withRefreshTokenFallback("old").refreshToken());
        }

        @Test
        @DisplayName("should keep a newly issued refresh token")
        void keepsNew() {
            final var token = new Token("a", "new", "Bearer", 60L, 100L, null, null);

            assertSame(token, token.withRefreshTokenFallback("old"));
        }
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        @DisplayName("should use snake_case names and omit absent fields")
        void serializes() throws Exception {
            final var token = new Token("abc", null, "Bearer", 3600L, 1_700_003_600L, "repo", null);

            final var json = mapper.readTree(mapper.writeValueAsString(token));

            assertEquals("abc", json.get("access_token").asText());
            assertEquals(3600L, json.get("expires_in").asLong());
            assertEquals(1_700_003_600L, json.get("expires_at").asLong());
            assertEquals("repo", json.get("scope").asText());
            assertFalse(json.has("refresh_token"));
            assertFalse(json.has("id_token"));
            assertFalse(json.has("expired"));
        }

        @Test
        @DisplayName("should read a stored record")
        void deserializes() throws Exception {
            final var json = "{\"access_token\":\"abc\",\"refresh_token\":\"r\",\"token_type\":\"bearer\","
                    + "\"expires_at\":42,\"id_token\":\"id\",\"extra\":true}";

            final var token = mapper.readValue(json, Token.class);

            assertEquals(new Token("abc", "r", "bearer", null, 42L, null, "id"), token);
        }
    }

    @Test
    @DisplayName("toString() should not reveal credentials")
    void toStringRedacts() {
        final var text = new Token("secret-access", "secret-refresh", "Bearer", 60L, 100L, null, null).toString();

        assertFalse(text.contains("secret"));
    }
}
