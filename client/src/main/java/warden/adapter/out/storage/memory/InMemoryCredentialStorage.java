package warden.adapter.out.storage.memory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.jboss.logging.Logger;

import warden.core.model.Session;
import warden.core.model.Token;
import warden.core.port.out.CredentialStorage;
import warden.core.util.SecureHash;

/**
 * Process-local credential storage.
 *
 * <p>Sessions and tokens are guarded by independent read-write locks, so a
 * session write never blocks a token read. Offers no cross-process refresh
 * lock; only suitable for a single process.
 */
public class InMemoryCredentialStorage implements CredentialStorage {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialStorage.class);

    private final Map<String, Session> sessions = new HashMap<>();
    private final Map<String, Token> tokens = new HashMap<>();
    private final ReentrantReadWriteLock sessionLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock tokenLock = new ReentrantReadWriteLock();

    @Override
    public void saveSession(String state, Session session) {
        sessionLock.writeLock().lock();
        try {
            sessions.put(state, session);
        } finally {
            sessionLock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Session> getSession(String state) {
        sessionLock.readLock().lock();
        try {
            return Optional.ofNullable(sessions.get(state));
        } finally {
            sessionLock.readLock().unlock();
        }
    }

    @Override
    public void deleteSession(String state) {
        sessionLock.writeLock().lock();
        try {
            sessions.remove(state);
        } finally {
            sessionLock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Session> consumeSession(String state) {
        sessionLock.writeLock().lock();
        try {
            return Optional.ofNullable(sessions.remove(state));
        } finally {
            sessionLock.writeLock().unlock();
        }
    }

    @Override
    public void saveToken(String key, Token token) {
        tokenLock.writeLock().lock();
        try {
            tokens.put(key, token);
        } finally {
            tokenLock.writeLock().unlock();
        }
        LOG.debugf("Stored token for key %s", SecureHash.forLog(key));
    }

    @Override
    public Optional<Token> getToken(String key) {
        tokenLock.readLock().lock();
        try {
            return Optional.ofNullable(tokens.get(key));
        } finally {
            tokenLock.readLock().unlock();
        }
    }

    @Override
    public void deleteToken(String key) {
        tokenLock.writeLock().lock();
        try {
            tokens.remove(key);
        } finally {
            tokenLock.writeLock().unlock();
        }
    }

    /**
     * Get the number of stored tokens (for monitoring).
     *
     * @return token count
     */
    public int tokenCount() {
        tokenLock.readLock().lock();
        try {
            return tokens.size();
        } finally {
            tokenLock.readLock().unlock();
        }
    }

    /**
     * Get the number of pending sessions (for monitoring).
     *
     * @return session count
     */
    public int sessionCount() {
        sessionLock.readLock().lock();
        try {
            return sessions.size();
        } finally {
            sessionLock.readLock().unlock();
        }
    }
}
