package warden.adapter.out.storage.file;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jboss.logging.Logger;

import warden.core.model.problem.CredentialProblem;
import warden.core.port.out.RefreshLock;
import warden.core.port.out.RefreshLockProvider;
import warden.core.util.SecureHash;

/**
 * Cross-process refresh locks built on exclusive {@link FileLock}s.
 *
 * <p>Each key maps to {@code <sha256(key)>.lock} in the lock directory. Lock
 * files are never deleted; only the OS lock on them matters, and the OS drops
 * it if the holding process dies.
 *
 * <p>OS file locks belong to the whole JVM, and closing any channel on a file
 * may release every lock the JVM holds on it. A JVM-wide permit per lock file
 * therefore guards channel creation, which also makes two managers over the
 * same directory in one JVM exclude each other exactly like two processes.
 */
public class FileRefreshLockManager implements RefreshLockProvider {

    private static final Logger LOG = Logger.getLogger(FileRefreshLockManager.class);
    private static final String LOCK_SUFFIX = ".lock";
    private static final long INITIAL_BACKOFF_MILLIS = 5L;
    private static final long MAX_BACKOFF_MILLIS = 100L;

    private static final ConcurrentMap<Path, Semaphore> JVM_PERMITS = new ConcurrentHashMap<>();

    private final Path lockDirectory;

    public FileRefreshLockManager(Path lockDirectory) {
        this.lockDirectory = lockDirectory.toAbsolutePath().normalize();
        try {
            StoragePaths.createPrivateDirectories(this.lockDirectory);
        } catch (IOException e) {
            throw CredentialProblem.storageFailure("cannot create lock directory " + this.lockDirectory, e);
        }
    }

    Path lockPath(String key) {
        return lockDirectory.resolve(SecureHash.sha256Hex(key) + LOCK_SUFFIX);
    }

    @Override
    public RefreshLock acquire(String key, Duration timeout) {
        final var deadline = System.nanoTime() + timeout.toNanos();
        var backoff = INITIAL_BACKOFF_MILLIS;

        while (true) {
            final var lock = tryAcquire(key);
            if (lock.isPresent()) {
                return lock.get();
            }

            final var remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) {
                LOG.debugf("Timed out acquiring refresh lock for key %s", SecureHash.forLog(key));
                throw CredentialProblem.lockTimeout(SecureHash.forLog(key));
            }

            try {
                Thread.sleep(Math.min(backoff, remainingMillis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw CredentialProblem.interrupted(e);
            }
            backoff = Math.min(backoff * 2, MAX_BACKOFF_MILLIS);
        }
    }

    @Override
    public Optional<RefreshLock> tryAcquire(String key) {
        final var path = lockPath(key);
        final var permit = JVM_PERMITS.computeIfAbsent(path, p -> new Semaphore(1));
        if (!permit.tryAcquire()) {
            return Optional.empty();
        }

        FileChannel channel = null;
        try {
            channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            final var fileLock = channel.tryLock();
            if (fileLock == null) {
                channel.close();
                permit.release();
                return Optional.empty();
            }
            LOG.debugf("Acquired refresh lock for key %s", SecureHash.forLog(key));
            return Optional.of(new FileRefreshLock(key, channel, fileLock, permit));
        } catch (IOException e) {
            closeAfterFailure(channel, e);
            permit.release();
            throw CredentialProblem.storageFailure("cannot lock " + path.getFileName(), e);
        } catch (RuntimeException e) {
            closeAfterFailure(channel, e);
            permit.release();
            throw e;
        }
    }

    private static void closeAfterFailure(FileChannel channel, Exception failure) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException closeError) {
            failure.addSuppressed(closeError);
        }
    }

    private static final class FileRefreshLock implements RefreshLock {

        private final String key;
        private final FileChannel channel;
        private final FileLock fileLock;
        private final Semaphore permit;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private FileRefreshLock(String key, FileChannel channel, FileLock fileLock, Semaphore permit) {
            this.key = key;
            this.channel = channel;
            this.fileLock = fileLock;
            this.permit = permit;
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public boolean isHeld() {
            return !released.get() && fileLock.isValid();
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                // Closing the channel releases the file lock
                channel.close();
            } catch (IOException e) {
                LOG.warnf(e, "Failed to close refresh lock channel for key %s", SecureHash.forLog(key));
            } finally {
                permit.release();
            }
            LOG.debugf("Released refresh lock for key %s", SecureHash.forLog(key));
        }
    }
}
