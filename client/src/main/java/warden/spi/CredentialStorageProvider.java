package warden.spi;

import warden.config.WardenConfig;
import warden.core.port.out.CredentialStorage;

/**
 * Service Provider Interface for credential storage backends.
 *
 * <p>Providers are discovered with {@link java.util.ServiceLoader}. Register a
 * custom provider in
 * {@code META-INF/services/warden.spi.CredentialStorageProvider}.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>{@code memory} - process-local maps, priority 0</li>
 *   <li>{@code file} - JSON files with cross-process locks, priority 10</li>
 * </ul>
 *
 * <p>When multiple providers are available, the one named by
 * {@code warden.storage.provider} is used; otherwise the highest priority wins.
 */
public interface CredentialStorageProvider {

    /**
     * Unique provider name used in {@code warden.storage.provider}.
     *
     * @return provider name
     */
    String name();

    /**
     * Priority for automatic selection. Higher wins.
     *
     * @return priority value
     */
    default int priority() {
        return 0;
    }

    /**
     * Whether this provider can operate in the current environment.
     *
     * @return true if the provider can create storage
     */
    boolean isAvailable();

    /**
     * Create the storage backend.
     *
     * @param config loaded configuration
     * @return storage instance
     */
    CredentialStorage createStorage(WardenConfig config);
}
