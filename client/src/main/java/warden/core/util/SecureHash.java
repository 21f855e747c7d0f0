package warden.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for credential keys.
 *
 * <p>Storage keys are caller-chosen strings that may contain path separators
 * or identify a user. Hashing them yields file names that are always valid and
 * log lines that never reveal the key itself.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;
    private static final int LOG_HEX_CHARS = 12;

    private SecureHash() {}

    /**
     * Full SHA-256 hex digest of the input.
     */
    public static String sha256Hex(String input) {
        return truncatedSha256(input, MAX_HEX_CHARS);
    }

    /**
     * Short digest suitable for log lines and error messages.
     */
    public static String forLog(String key) {
        return truncatedSha256(key, LOG_HEX_CHARS);
    }

    /**
     * Return a truncated SHA-256 hex digest of the input string.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if hexChars is less than 1 or greater than 64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            final var hashBytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes).substring(0, hexChars);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required of every JVM", e);
        }
    }
}
