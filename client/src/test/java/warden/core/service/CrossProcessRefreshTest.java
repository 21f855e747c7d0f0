package warden.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import warden.adapter.out.storage.file.FileCredentialStorage;
import warden.adapter.out.telemetry.NoOpCredentialMetrics;
import warden.config.TestWardenConfig;
import warden.core.model.OAuthConfig;
import warden.core.model.Token;
import warden.core.model.problem.CredentialException;
import warden.core.model.problem.CredentialException.Kind;

/**
 * Two storages over one directory behave like two processes sharing a data
 * directory: each has its own refresher and in-flight table, and only the
 * file locks coordinate them.
 */
@DisplayName("Refresh coordination across processes")
class CrossProcessRefreshTest {

    private static final String KEY = "github";

    @TempDir
    Path dataDir;

    private StubTokenEndpoint endpoint;
    private TestWardenConfig config;
    private FileCredentialStorage storageA;
    private FileCredentialStorage storageB;
    private TokenRefresher refresherA;
    private TokenRefresher refresherB;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        endpoint = StubTokenEndpoint.issuingSequentialTokens(3600L).withDelay(Duration.ofMillis(300));
        config = new TestWardenConfig().lockTimeout(Duration.ofSeconds(5));
        storageA = new FileCredentialStorage(dataDir);
        storageB = new FileCredentialStorage(dataDir);
        refresherA = refresher(storageA);
        refresherB = refresher(storageB);
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private TokenRefresher refresher(FileCredentialStorage storage) {
        final var client = new OAuthFlowClient(OAuthConfig.github("client", null), storage, endpoint, config);
        return new TokenRefresher(client, config, NoOpCredentialMetrics.INSTANCE);
    }

    private void storeExpiredToken() {
        final var now = Instant.now().getEpochSecond();
        storageA.saveToken(KEY, new Token("original", "rt-0", "Bearer", 3600L, now - 60, null, null));
    }

    @Test
    @DisplayName("callers in both processes should trigger a single refresh")
    void singleRefreshAcrossProcesses() throws Exception {
        storeExpiredToken();
        final var start = new CountDownLatch(1);
        final var results = new ArrayList<Future<Token>>();
        for (int i = 0; i < 8; i++) {
            final var refresher = i % 2 == 0 ? refresherA : refresherB;
            results.add(executor.submit(() -> {
                start.await();
                return refresher.getValidToken(KEY);
            }));
        }

        start.countDown();

        for (var result : results) {
            assertEquals("refreshed-1", result.get(10, TimeUnit.SECONDS).accessToken());
        }
        assertEquals(1, endpoint.callCount());
        assertEquals("refreshed-1", storageB.getToken(KEY).orElseThrow().accessToken());
    }

    @Test
    @DisplayName("should use the token another process stored while the lock was held")
    void skipsRefreshDoneElsewhere() throws Exception {
        storeExpiredToken();
        final var lock = storageB.refreshLocks().orElseThrow().acquire(KEY, Duration.ofSeconds(1));

        final var pending = executor.submit(() -> refresherA.getValidToken(KEY));
        Thread.sleep(200);
        final var fresh = Token.issued("from-b", "rt-b", "Bearer", 3600L, null, null, Instant.now());
        storageB.saveToken(KEY, fresh);
        lock.close();

        assertEquals("from-b", pending.get(10, TimeUnit.SECONDS).accessToken());
        assertEquals(0, endpoint.callCount());
    }

    @Test
    @DisplayName("a forced refresh should not repeat a refresh another process just completed")
    void forcedRefreshSkipsReplacedToken() throws Exception {
        storeExpiredToken();
        final var lock = storageB.refreshLocks().orElseThrow().acquire(KEY, Duration.ofSeconds(1));

        final var pending = executor.submit(() -> refresherA.refreshTokenForKey(KEY));
        Thread.sleep(200);
        storageB.saveToken(KEY, Token.issued("from-b", "rt-b", "Bearer", 3600L, null, null, Instant.now()));
        lock.close();

        assertEquals("from-b", pending.get(10, TimeUnit.SECONDS).accessToken());
        assertEquals(0, endpoint.callCount());
    }

    @Test
    @DisplayName("a forced refresh joining an expiry refresh should still replace the token it observed")
    void forcedRefreshJoiningExpiryRefresh() throws Exception {
        storeExpiredToken();
        final var lock = storageB.refreshLocks().orElseThrow().acquire(KEY, Duration.ofSeconds(1));

        final var expiryCaller = executor.submit(() -> refresherA.getValidToken(KEY));
        awaitRefreshing(refresherA);
        storageB.saveToken(KEY, Token.issued("R1", "rt-b", "Bearer", 3600L, null, null, Instant.now()));
        final var forcedCaller = executor.submit(() -> refresherA.refreshTokenForKey(KEY));
        Thread.sleep(200);
        lock.close();

        assertEquals("R1", expiryCaller.get(10, TimeUnit.SECONDS).accessToken());
        final var forced = forcedCaller.get(10, TimeUnit.SECONDS);
        assertNotEquals("R1", forced.accessToken());
        assertEquals("refreshed-1", forced.accessToken());
        assertEquals("rt-b", endpoint.lastRequest().form().get("refresh_token"));
        assertEquals(1, endpoint.callCount());
    }

    private static void awaitRefreshing(TokenRefresher refresher) throws InterruptedException {
        final var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!refresher.isRefreshing(KEY) && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(refresher.isRefreshing(KEY));
    }

    @Test
    @DisplayName("should time out when another process holds the lock too long")
    void lockTimeout() {
        storeExpiredToken();
        config.lockTimeout(Duration.ofMillis(150));
        final var shortLock = refresher(storageA);

        try (var lock = storageB.refreshLocks().orElseThrow().acquire(KEY, Duration.ofSeconds(1))) {
            final var ex = assertThrows(CredentialException.class, () -> shortLock.getValidToken(KEY));

            assertEquals(Kind.LOCK_TIMEOUT, ex.kind());
            assertFalse(shortLock.isRefreshing(KEY));
        }
        assertEquals(0, endpoint.callCount());
    }

    @Test
    @DisplayName("waitForRefresh should block while another process holds the lock")
    void waitForRefreshAcrossProcesses() throws Exception {
        storeExpiredToken();
        final var lock = storageB.refreshLocks().orElseThrow().acquire(KEY, Duration.ofSeconds(1));

        final var waiting = executor.submit(() -> refresherA.waitForRefresh(KEY));
        Thread.sleep(150);
        assertFalse(waiting.isDone());

        lock.close();
        waiting.get(10, TimeUnit.SECONDS);
    }
}
