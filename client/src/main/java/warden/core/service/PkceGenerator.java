package warden.core.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * PKCE (Proof Key for Code Exchange) value generation.
 *
 * <p>Implements the client side of RFC 7636. Only the S256 challenge method is
 * produced; the plain method provides no protection against interception.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636</a>
 */
public class PkceGenerator {

    public static final String S256_METHOD = "S256";
    private static final int VERIFIER_BYTES = 64;
    private static final int STATE_BYTES = 32;

    private final SecureRandom random;

    public PkceGenerator() {
        this(new SecureRandom());
    }

    public PkceGenerator(SecureRandom random) {
        this.random = random;
    }

    /**
     * Generate a cryptographically secure code verifier.
     *
     * <p>Per RFC 7636, the verifier must be between 43-128 characters,
     * using unreserved characters (A-Z, a-z, 0-9, "-", ".", "_", "~").
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateCodeVerifier() {
        return randomUrlSafe(VERIFIER_BYTES);
    }

    /**
     * Compute the S256 challenge: BASE64URL(SHA256(verifier)).
     *
     * @param verifier the code verifier
     * @return Base64URL encoded SHA-256 hash of the verifier
     */
    public String generateChallenge(String verifier) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            final var hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Generate a cryptographically secure state parameter.
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateState() {
        return randomUrlSafe(STATE_BYTES);
    }

    private String randomUrlSafe(int length) {
        final var bytes = new byte[length];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
