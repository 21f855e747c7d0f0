package warden.core.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.model.Token;
import warden.core.model.problem.CredentialException;
import warden.core.model.problem.CredentialProblem;
import warden.core.port.out.CredentialMetrics;
import warden.core.port.out.CredentialMetrics.RefreshOutcome;
import warden.core.port.out.CredentialStorage;
import warden.core.port.out.RefreshLock;
import warden.core.util.SecureHash;

/**
 * Returns usable access tokens, refreshing them at most once per key at a time.
 *
 * <p>Per key a token is <em>valid</em> (returned as is), <em>stale</em> (its
 * elapsed lifetime reached the caller's threshold), <em>expired</em>, or
 * <em>refreshing</em>. Reading a valid token takes no lock.
 *
 * <p>When a refresh is needed, the first caller for a key becomes the leader
 * and every other caller in this process waits for the leader's outcome. The
 * leader takes the storage's cross-process lock when it has one, re-reads the
 * token, and refreshes only if the re-read token still needs it. Another
 * process may have refreshed while the leader waited for the lock, in which
 * case the stored token is returned without contacting the server.
 *
 * <p>Failures are not retried. The leader and all of its waiters receive the
 * same exception.
 */
public class TokenRefresher {

    private static final Logger LOG = Logger.getLogger(TokenRefresher.class);

    /** Refresh only once the token has expired. */
    public static final double EXPIRY_THRESHOLD = 1.0;

    private final OAuthFlowClient client;
    private final CredentialStorage storage;
    private final CredentialMetrics metrics;
    private final Duration waitTimeout;
    private final Duration lockTimeout;
    private final Clock clock;
    private final ConcurrentMap<String, CompletableFuture<Token>> inFlight = new ConcurrentHashMap<>();

    public TokenRefresher(OAuthFlowClient client, WardenConfig config, CredentialMetrics metrics) {
        this(client, config, metrics, client.clock());
    }

    TokenRefresher(OAuthFlowClient client, WardenConfig config, CredentialMetrics metrics, Clock clock) {
        this.client = client;
        this.storage = client.storage();
        this.metrics = metrics;
        this.waitTimeout = config.refresh().waitTimeout();
        this.lockTimeout = config.lock().timeout();
        this.clock = clock;
    }

    /**
     * Return the stored token, refreshing it first if it has expired.
     *
     * @param key storage key
     * @return a non-expired token, or the stored token if it has no expiration
     * @throws CredentialException with kind {@code TOKEN_NOT_FOUND}, {@code NO_REFRESH_TOKEN},
     *         {@code LOCK_TIMEOUT} or any refresh failure
     */
    public Token getValidToken(String key) {
        return getValidTokenWithThreshold(key, EXPIRY_THRESHOLD);
    }

    public Token getValidToken(String key, Duration timeout) {
        return getValidTokenWithThreshold(key, EXPIRY_THRESHOLD, timeout);
    }

    /**
     * Return the stored token, refreshing it first when it has expired or when
     * at least {@code threshold} of its lifetime has elapsed.
     *
     * <p>A threshold of 0.8 refreshes once 80% of {@code expires_in} has passed.
     * Tokens without {@code expires_at} are returned unchanged.
     *
     * @param key       storage key
     * @param threshold elapsed lifetime fraction in {@code [0, 1]}
     * @return a token that does not need refreshing under {@code threshold}
     * @throws IllegalArgumentException if threshold is outside {@code [0, 1]}
     */
    public Token getValidTokenWithThreshold(String key, double threshold) {
        return getValidTokenWithThreshold(key, threshold, waitTimeout);
    }

    public Token getValidTokenWithThreshold(String key, double threshold, Duration timeout) {
        requireKey(key);
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0, got " + threshold);
        }

        final var current = readToken(key);
        if (!needsRefresh(current, threshold, clock.instant())) {
            return current;
        }

        LOG.debugf("Token for key %s needs refresh (threshold %.2f)", SecureHash.forLog(key), threshold);
        return coordinate(
                key, timeout, latest -> needsRefresh(latest, threshold, clock.instant()), joined -> true);
    }

    /**
     * Refresh the token for {@code key} regardless of its expiration.
     *
     * <p>If another process replaces the token while this call waits for the
     * lock, that replacement is returned instead of refreshing again.
     *
     * @param key storage key
     * @return the refreshed token
     */
    public Token refreshTokenForKey(String key) {
        return refreshTokenForKey(key, waitTimeout);
    }

    public Token refreshTokenForKey(String key, Duration timeout) {
        requireKey(key);
        final var observed = readToken(key);
        final Predicate<Token> unchanged = latest -> latest.accessToken().equals(observed.accessToken());
        return coordinate(key, timeout, unchanged, unchanged.negate());
    }

    /**
     * Block until no refresh for {@code key} is in progress in this process or,
     * for storage with cross-process locks, in any process.
     *
     * <p>The outcome of the awaited refresh belongs to the caller that started
     * it and is not reported here.
     *
     * @throws CredentialException with kind {@code LOCK_TIMEOUT} or {@code INTERRUPTED}
     */
    public void waitForRefresh(String key) {
        waitForRefresh(key, waitTimeout);
    }

    public void waitForRefresh(String key, Duration timeout) {
        requireKey(key);
        final var deadline = System.nanoTime() + timeout.toNanos();

        final var pending = inFlight.get(key);
        if (pending != null) {
            try {
                pending.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            } catch (ExecutionException e) {
                LOG.debugf("Awaited refresh for key %s failed: %s", SecureHash.forLog(key), e.getCause());
            } catch (TimeoutException e) {
                metrics.recordLockTimeout();
                throw CredentialProblem.lockTimeout(SecureHash.forLog(key));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw CredentialProblem.interrupted(e);
            }
        }

        final var remaining = Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
        acquireCrossProcessLock(key, remaining).ifPresent(RefreshLock::close);
    }

    /**
     * Whether a refresh for {@code key} is currently led by a thread in this process.
     */
    public boolean isRefreshing(String key) {
        return inFlight.containsKey(key);
    }

    static boolean needsRefresh(Token token, double threshold, Instant now) {
        if (token.expiresAt() == null) {
            return false;
        }
        if (token.isExpired(now)) {
            return true;
        }
        final var elapsed = token.elapsedLifetimeFraction(now);
        return elapsed.isPresent() && elapsed.getAsDouble() >= threshold;
    }

    /**
     * Lead or join the refresh for {@code key}.
     *
     * <p>A joined refresh may have been started with a different predicate; a
     * forced refresh joining a threshold refresh can get back the token it
     * wanted replaced. When {@code acceptJoined} rejects the joined outcome the
     * caller goes round again, leading or joining the next refresh, until the
     * deadline.
     */
    private Token coordinate(
            String key, Duration timeout, Predicate<Token> stillNeedsRefresh, Predicate<Token> acceptJoined) {
        final var deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            final var remaining = Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
            final var ownFuture = new CompletableFuture<Token>();
            final var existing = inFlight.putIfAbsent(key, ownFuture);
            if (existing != null) {
                metrics.recordCoalescedWait();
                LOG.debugf("Joining in-flight refresh for key %s", SecureHash.forLog(key));
                final var joined = await(key, existing, remaining);
                if (acceptJoined.test(joined)) {
                    return joined;
                }
                LOG.debugf("Joined refresh for key %s kept the current token, retrying", SecureHash.forLog(key));
                continue;
            }

            try {
                final var lockWait = remaining.compareTo(lockTimeout) < 0 ? remaining : lockTimeout;
                final var token = lead(key, lockWait, stillNeedsRefresh);
                ownFuture.complete(token);
                return token;
            } catch (RuntimeException | Error e) {
                ownFuture.completeExceptionally(e);
                throw e;
            } finally {
                inFlight.remove(key, ownFuture);
            }
        }
    }

    private Token lead(String key, Duration lockWait, Predicate<Token> stillNeedsRefresh) {
        final var started = System.nanoTime();
        final var lock = acquireCrossProcessLock(key, lockWait);
        try {
            final var latest = readToken(key);
            if (!stillNeedsRefresh.test(latest)) {
                LOG.debugf("Token for key %s was refreshed elsewhere", SecureHash.forLog(key));
                metrics.recordRefresh(RefreshOutcome.SKIPPED, elapsedSince(started));
                return latest;
            }

            final var refreshed = client.refresh(latest);
            storage.saveToken(key, refreshed);
            metrics.recordRefresh(RefreshOutcome.REFRESHED, elapsedSince(started));
            LOG.infof("Refreshed token for key %s", SecureHash.forLog(key));
            return refreshed;
        } catch (CredentialException e) {
            metrics.recordRefresh(RefreshOutcome.FAILED, elapsedSince(started));
            LOG.warnf("Refresh for key %s failed: %s", SecureHash.forLog(key), e.kind());
            throw e;
        } finally {
            lock.ifPresent(RefreshLock::close);
        }
    }

    private Optional<RefreshLock> acquireCrossProcessLock(String key, Duration wait) {
        try {
            return storage.refreshLocks().map(locks -> locks.acquire(key, wait));
        } catch (CredentialException e) {
            if (e.kind() == CredentialException.Kind.LOCK_TIMEOUT) {
                metrics.recordLockTimeout();
            }
            throw e;
        }
    }

    private Token await(String key, CompletableFuture<Token> future, Duration timeout) {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            metrics.recordLockTimeout();
            throw CredentialProblem.lockTimeout(SecureHash.forLog(key));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CredentialProblem.interrupted(e);
        } catch (ExecutionException e) {
            final var cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Refresh failed", cause);
        }
    }

    private Token readToken(String key) {
        return storage.getToken(key).orElseThrow(() -> CredentialProblem.tokenNotFound(SecureHash.forLog(key)));
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
    }
}
