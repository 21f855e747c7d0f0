package warden.adapter.out.storage.file;

import java.nio.file.Path;

import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.port.out.CredentialStorage;
import warden.spi.CredentialStorageProvider;

/**
 * File-backed credential storage provider.
 *
 * <p>Stores credentials under {@code warden.storage.directory}, or the platform
 * data directory for {@code warden.storage.app-name}. Lock files go to
 * {@code warden.lock.directory}, or {@code locks/} under the storage directory.
 */
public class FileCredentialStorageProvider implements CredentialStorageProvider {

    private static final Logger LOG = Logger.getLogger(FileCredentialStorageProvider.class);
    private static final int PRIORITY = 10;

    @Override
    public String name() {
        return "file";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public CredentialStorage createStorage(WardenConfig config) {
        final var baseDirectory = config.storage()
                .directory()
                .map(Path::of)
                .orElseGet(() -> StoragePaths.defaultDataDirectory(config.storage().appName()));
        final var lockDirectory = config.lock()
                .directory()
                .map(Path::of)
                .orElseGet(() -> baseDirectory.resolve(FileCredentialStorage.LOCKS_DIR));

        LOG.infof("Using file credential storage at %s (locks: %s)", baseDirectory, lockDirectory);
        return new FileCredentialStorage(baseDirectory, lockDirectory);
    }
}
