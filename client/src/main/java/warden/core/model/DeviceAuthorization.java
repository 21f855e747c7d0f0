package warden.core.model;

import java.time.Duration;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Device authorization response (RFC 8628, section 3.2).
 *
 * @param deviceCode              device verification code, sent when polling
 * @param userCode                code the user enters at the verification URI
 * @param verificationUri         where the user authorizes the device
 * @param verificationUriComplete verification URI with the user code embedded, may be null
 * @param expiresIn               lifetime of the device code in seconds
 * @param interval                minimum polling interval in seconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeviceAuthorization(
        @JsonProperty("device_code") String deviceCode,
        @JsonProperty("user_code") String userCode,
        @JsonProperty("verification_uri") String verificationUri,
        @JsonProperty("verification_uri_complete") String verificationUriComplete,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("interval") Long interval) {

    public static final long DEFAULT_INTERVAL_SECONDS = 5L;
    private static final long MAX_INTERVAL_SECONDS = 300L;

    public DeviceAuthorization {
        if (deviceCode == null || deviceCode.isBlank()) {
            throw new IllegalArgumentException("device_code is required");
        }
        if (userCode == null || userCode.isBlank()) {
            throw new IllegalArgumentException("user_code is required");
        }
        if (verificationUri == null || verificationUri.isBlank()) {
            throw new IllegalArgumentException("verification_uri is required");
        }
        if (interval == null || interval < 1 || interval > MAX_INTERVAL_SECONDS) {
            interval = DEFAULT_INTERVAL_SECONDS;
        }
    }

    public Optional<String> completeUri() {
        return Optional.ofNullable(verificationUriComplete);
    }

    public Duration pollInterval() {
        return Duration.ofSeconds(interval);
    }
}
