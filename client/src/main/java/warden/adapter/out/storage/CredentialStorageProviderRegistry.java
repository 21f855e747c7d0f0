package warden.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.port.out.CredentialStorage;
import warden.spi.CredentialStorageProvider;

/**
 * Discovers credential storage providers via ServiceLoader and selects one.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider ({@code warden.storage.provider}), if available</li>
 *   <li>Highest priority available provider</li>
 *   <li>Otherwise {@link IllegalStateException}; the bundled memory provider
 *       is always available, so this only happens with a custom provider list</li>
 * </ol>
 */
public class CredentialStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(CredentialStorageProviderRegistry.class);

    private final List<CredentialStorageProvider> providers;
    private final WardenConfig config;

    private volatile CredentialStorageProvider selectedProvider;
    private volatile CredentialStorage storage;

    public CredentialStorageProviderRegistry(WardenConfig config) {
        this(discover(), config);
    }

    public CredentialStorageProviderRegistry(List<CredentialStorageProvider> providers, WardenConfig config) {
        this.providers = List.copyOf(providers);
        this.config = config;
    }

    private static List<CredentialStorageProvider> discover() {
        final var found = new ArrayList<CredentialStorageProvider>();
        ServiceLoader.load(CredentialStorageProvider.class).forEach(found::add);
        LOG.debugf(
                "Found %d credential storage provider(s): %s",
                found.size(),
                found.stream().map(CredentialStorageProvider::name).toList());
        return found;
    }

    /**
     * Get the storage created by the selected provider.
     *
     * @return credential storage instance
     */
    public synchronized CredentialStorage getStorage() {
        if (storage == null) {
            storage = getSelectedProvider().createStorage(config);
        }
        return storage;
    }

    /**
     * Get the selected storage provider.
     *
     * @return selected provider
     */
    public synchronized CredentialStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    /**
     * Get all available providers.
     *
     * @return list of available providers
     */
    public List<CredentialStorageProvider> getAvailableProviders() {
        return providers.stream().filter(CredentialStorageProvider::isAvailable).toList();
    }

    private CredentialStorageProvider selectProvider() {
        final var configuredProvider = config.storage().provider();
        final var availableProviders = providers.stream()
                .filter(CredentialStorageProvider::isAvailable)
                .sorted(Comparator.comparingInt(CredentialStorageProvider::priority)
                        .reversed())
                .toList();

        final var configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();
        if (configured.isPresent()) {
            LOG.infof("Using configured credential storage provider: %s", configuredProvider);
            return configured.get();
        }

        LOG.warnf("Configured credential storage provider '%s' is not available, falling back", configuredProvider);
        if (!availableProviders.isEmpty()) {
            final var provider = availableProviders.get(0);
            LOG.infof("Using credential storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No credential storage providers available");
    }
}
