package warden.adapter.out.storage.file;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import warden.core.model.Session;
import warden.core.model.Token;
import warden.core.model.problem.CredentialProblem;
import warden.core.port.out.CredentialStorage;
import warden.core.port.out.RefreshLockProvider;
import warden.core.util.SecureHash;

/**
 * File-backed credential storage shared by every process pointing at the same
 * directory.
 *
 * <p>Layout under the base directory:
 * <pre>
 *   sessions/&lt;sha256(state)&gt;.json
 *   tokens/&lt;sha256(key)&gt;.json
 *   locks/&lt;sha256(key)&gt;.lock
 * </pre>
 *
 * <p>Records are written to a temporary file in the target directory and then
 * renamed over the old record, so readers see either the previous or the new
 * record and never a partial one. Files are owner-only where the file system
 * supports POSIX permissions.
 */
public class FileCredentialStorage implements CredentialStorage {

    private static final Logger LOG = Logger.getLogger(FileCredentialStorage.class);

    static final String SESSIONS_DIR = "sessions";
    static final String TOKENS_DIR = "tokens";
    static final String LOCKS_DIR = "locks";
    private static final String RECORD_SUFFIX = ".json";

    private final Path baseDirectory;
    private final Path sessionsDirectory;
    private final Path tokensDirectory;
    private final FileRefreshLockManager lockManager;
    private final ObjectMapper mapper;

    public FileCredentialStorage(Path baseDirectory) {
        this(baseDirectory, baseDirectory.resolve(LOCKS_DIR));
    }

    public FileCredentialStorage(Path baseDirectory, Path lockDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
        this.sessionsDirectory = this.baseDirectory.resolve(SESSIONS_DIR);
        this.tokensDirectory = this.baseDirectory.resolve(TOKENS_DIR);
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        try {
            StoragePaths.createPrivateDirectories(sessionsDirectory);
            StoragePaths.createPrivateDirectories(tokensDirectory);
        } catch (IOException e) {
            throw CredentialProblem.storageFailure("cannot create storage directory " + this.baseDirectory, e);
        }
        this.lockManager = new FileRefreshLockManager(lockDirectory);

        LOG.debugf("File credential storage at %s", this.baseDirectory);
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    @Override
    public void saveSession(String state, Session session) {
        write(sessionsDirectory, state, session);
    }

    @Override
    public Optional<Session> getSession(String state) {
        return read(recordPath(sessionsDirectory, state), Session.class);
    }

    @Override
    public void deleteSession(String state) {
        delete(recordPath(sessionsDirectory, state));
    }

    /**
     * Claims the session file by renaming it first; of several concurrent
     * callers only the one whose rename succeeds sees the session.
     */
    @Override
    public Optional<Session> consumeSession(String state) {
        final var path = recordPath(sessionsDirectory, state);
        final var claimed = sessionsDirectory.resolve(path.getFileName() + ".consumed-" + UUID.randomUUID());
        try {
            Files.move(path, claimed, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw CredentialProblem.storageFailure("cannot claim session record", e);
        }

        try {
            return read(claimed, Session.class);
        } finally {
            delete(claimed);
        }
    }

    @Override
    public void saveToken(String key, Token token) {
        write(tokensDirectory, key, token);
        LOG.debugf("Stored token for key %s", SecureHash.forLog(key));
    }

    @Override
    public Optional<Token> getToken(String key) {
        return read(recordPath(tokensDirectory, key), Token.class);
    }

    @Override
    public void deleteToken(String key) {
        delete(recordPath(tokensDirectory, key));
    }

    @Override
    public Optional<RefreshLockProvider> refreshLocks() {
        return Optional.of(lockManager);
    }

    Path recordPath(Path directory, String key) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        return directory.resolve(SecureHash.sha256Hex(key) + RECORD_SUFFIX);
    }

    private void write(Path directory, String key, Object record) {
        final var target = recordPath(directory, key);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, ".write-", ".tmp");
            mapper.writeValue(temp.toFile(), record);
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            deleteTempFile(temp, e);
            throw CredentialProblem.storageFailure("cannot write " + target.getFileName(), e);
        }
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debugf("Atomic move not supported for %s, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private <T> Optional<T> read(Path path, Class<T> type) {
        final byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw CredentialProblem.storageFailure("cannot read " + path.getFileName(), e);
        }

        try {
            final var value = mapper.readValue(bytes, type);
            if (value == null) {
                throw CredentialProblem.storageFailure("empty record " + path.getFileName(), null);
            }
            return Optional.of(value);
        } catch (IOException e) {
            LOG.warnf("Corrupt %s record %s", type.getSimpleName(), path.getFileName());
            throw CredentialProblem.storageFailure("corrupt record " + path.getFileName(), e);
        }
    }

    private static void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw CredentialProblem.storageFailure("cannot delete " + path.getFileName(), e);
        }
    }

    private static void deleteTempFile(Path temp, IOException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupError) {
            failure.addSuppressed(cleanupError);
        }
    }
}
