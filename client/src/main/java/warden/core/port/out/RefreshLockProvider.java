package warden.core.port.out;

import java.time.Duration;
import java.util.Optional;

/**
 * Exclusive per-key locks shared by every process using the same storage.
 */
public interface RefreshLockProvider {

    /**
     * Block until the lock for {@code key} is held or {@code timeout} elapses.
     *
     * @throws warden.core.model.problem.CredentialException with kind
     *         {@code LOCK_TIMEOUT} when the deadline passes, or {@code INTERRUPTED}
     */
    RefreshLock acquire(String key, Duration timeout);

    /**
     * Take the lock only if it is free right now.
     */
    Optional<RefreshLock> tryAcquire(String key);
}
