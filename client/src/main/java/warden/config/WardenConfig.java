package warden.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for the credential lifecycle manager.
 *
 * <p>Configuration prefix: {@code warden}
 */
@ConfigMapping(prefix = "warden")
public interface WardenConfig {

    /**
     * Token refresh configuration.
     */
    Refresh refresh();

    /**
     * Cross-process lock configuration.
     */
    Lock lock();

    /**
     * Pending authorization session configuration.
     */
    SessionSettings session();

    /**
     * Token endpoint transport configuration.
     */
    Transport transport();

    /**
     * Device authorization grant configuration.
     */
    Device device();

    /**
     * Storage provider configuration.
     */
    Storage storage();

    /**
     * Loopback redirect server configuration.
     */
    Callback callback();

    /**
     * Metrics configuration.
     */
    Metrics metrics();

    interface Refresh {

        /**
         * Maximum time a caller waits for an in-flight refresh.
         */
        @WithName("wait-timeout")
        @WithDefault("PT60S")
        Duration waitTimeout();
    }

    interface Lock {

        /**
         * Maximum time the refresh leader waits for the cross-process lock.
         */
        @WithDefault("PT30S")
        Duration timeout();

        /**
         * Directory for lock files. Defaults to {@code locks/} under the storage directory.
         */
        Optional<String> directory();
    }

    interface SessionSettings {

        /**
         * Maximum age of a pending session before its callback is rejected.
         */
        @WithName("max-age")
        @WithDefault("PT10M")
        Duration maxAge();
    }

    interface Transport {

        /**
         * Timeout for a single token endpoint round trip.
         */
        @WithDefault("PT10S")
        Duration timeout();
    }

    interface Device {

        /**
         * Lower bound for the device flow polling interval.
         */
        @WithName("min-poll-interval")
        @WithDefault("PT5S")
        Duration minPollInterval();
    }

    interface Storage {

        /**
         * Storage provider name: {@code memory} or {@code file}.
         */
        @WithDefault("file")
        String provider();

        /**
         * Application name used to derive default storage directories.
         */
        @WithName("app-name")
        @WithDefault("warden")
        String appName();

        /**
         * Base directory for file storage. Defaults to the platform data directory.
         */
        Optional<String> directory();
    }

    interface Callback {

        /**
         * Port to listen on at 127.0.0.1; 0 picks a free port.
         */
        @WithDefault("0")
        int port();

        /**
         * How long to wait for the browser to be redirected back.
         */
        @WithDefault("PT5M")
        Duration timeout();
    }

    interface Metrics {

        @WithDefault("true")
        boolean enabled();
    }
}
