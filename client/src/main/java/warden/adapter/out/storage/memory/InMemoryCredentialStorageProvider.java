package warden.adapter.out.storage.memory;

import java.util.concurrent.atomic.AtomicBoolean;

import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.port.out.CredentialStorage;
import warden.spi.CredentialStorageProvider;

/**
 * In-memory credential storage provider.
 *
 * <p>Always available; used as a fallback when no other provider can run.
 *
 * <p><strong>Warning:</strong> tokens do not survive a restart and refreshes
 * are only coordinated within this process.
 */
public class InMemoryCredentialStorageProvider implements CredentialStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialStorageProvider.class);
    private static final int PRIORITY = 0; // Lowest priority - fallback only

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);

    @Override
    public String name() {
        return "memory";
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
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: credential storage is in-memory only!");
            LOG.warn("  Tokens are lost on exit and refreshes are not coordinated");
            LOG.warn("  across processes. Use the 'file' provider to share credentials.");
            LOG.warn("========================================================================");
        }
        return new InMemoryCredentialStorage();
    }
}
