package warden.core.port.out;

import java.util.Optional;

import warden.core.model.Session;
import warden.core.model.Token;

/**
 * Port for persisting pending sessions and issued tokens.
 *
 * <p>Keys are opaque strings. Contract for every implementation:
 * <ul>
 *   <li>{@code save*} overwrites any existing record (last writer wins)</li>
 *   <li>{@code get*} returns empty for an absent key and throws
 *       {@link warden.core.model.problem.CredentialException} with kind
 *       {@code STORAGE_FAILURE} only when the medium malfunctions</li>
 *   <li>{@code delete*} is idempotent</li>
 *   <li>implementations are safe for concurrent use</li>
 * </ul>
 */
public interface CredentialStorage {

    void saveSession(String state, Session session);

    Optional<Session> getSession(String state);

    void deleteSession(String state);

    void saveToken(String key, Token token);

    Optional<Token> getToken(String key);

    void deleteToken(String key);

    /**
     * Read and remove a session in one step.
     *
     * <p>The default is a plain get-then-delete. Implementations override it so
     * that concurrent callers cannot both observe the same session.
     *
     * @param state session key
     * @return the session if it was present
     */
    default Optional<Session> consumeSession(String state) {
        final var session = getSession(state);
        session.ifPresent(s -> deleteSession(state));
        return session;
    }

    /**
     * Cross-process refresh locks backed by this storage's medium.
     *
     * @return lock provider, or empty when the storage is process-local
     */
    default Optional<RefreshLockProvider> refreshLocks() {
        return Optional.empty();
    }
}
