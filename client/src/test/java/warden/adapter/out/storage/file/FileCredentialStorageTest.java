package warden.adapter.out.storage.file;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import warden.core.model.Token;
import warden.core.model.problem.CredentialException;
import warden.core.model.problem.CredentialException.Kind;
import warden.core.util.SecureHash;

@DisplayName("FileCredentialStorage")
class FileCredentialStorageTest {

    @TempDir
    Path tempDir;

    private Path base;
    private FileCredentialStorage storage;

    @BeforeEach
    void setUp() {
        base = tempDir.resolve("warden");
        storage = new FileCredentialStorage(base);
    }

    private static Token token(String accessToken) {
        return Token.issued(accessToken, "r", "Bearer", 3600L, null, null, Instant.now());
    }

    @Nested
    @DisplayName("Layout")
    class Layout {

        @Test
        @DisplayName("should store each token as a hashed JSON file under tokens/")
        void tokenFile() throws Exception {
            storage.saveToken("user/github", token("abc"));

            final var file = base.resolve("tokens").resolve(SecureHash.sha256Hex("user/github") + ".json");
            assertTrue(Files.exists(file));
            assertTrue(Files.readString(file).contains("\"access_token\":\"abc\""));
        }

        @Test
        @DisplayName("should leave no temporary files behind")
        void noTempFiles() throws Exception {
            storage.saveToken("k", token("one"));
            storage.saveToken("k", token("two"));

            try (var files = Files.list(base.resolve("tokens"))) {
                assertEquals(1, files.count());
            }
        }

        @Test
        @DisplayName("should see records written by another instance on the same directory")
        void sharedDirectory() {
            final var other = new FileCredentialStorage(base);

            other.saveToken("k", token("from-other"));

            assertEquals("from-other", storage.getToken("k").orElseThrow().accessToken());
        }

        @Test
        @DisplayName("should place lock files in the configured directory")
        void customLockDirectory() {
            final var locks = tempDir.resolve("locks-elsewhere");
            final var custom = new FileCredentialStorage(base, locks);

            try (var lock = custom.refreshLocks().orElseThrow().acquire("k", Duration.ofSeconds(1))) {
                assertTrue(lock.isHeld());
            }
            assertTrue(Files.exists(locks.resolve(SecureHash.sha256Hex("k") + ".lock")));
        }
    }

    @Nested
    @DisplayName("Permissions")
    class Permissions {

        @Test
        @DisplayName("should make token files readable by the owner only")
        void ownerOnlyFiles() throws Exception {
            assumeTrue(StoragePaths.supportsPosix(tempDir));

            storage.saveToken("k", token("abc"));

            final var file = base.resolve("tokens").resolve(SecureHash.sha256Hex("k") + ".json");
            final var perms = Files.getPosixFilePermissions(file);
            assertEquals(Set.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE), perms);
        }

        @Test
        @DisplayName("should create directories accessible by the owner only")
        void ownerOnlyDirectories() throws Exception {
            assumeTrue(StoragePaths.supportsPosix(tempDir));

            final var perms = Files.getPosixFilePermissions(base.resolve("tokens"));

            assertFalse(perms.stream()
                    .map(PosixFilePermission::name)
                    .anyMatch(name -> name.startsWith("GROUP") || name.startsWith("OTHERS")));
        }
    }

    @Nested
    @DisplayName("Corruption")
    class Corruption {

        @Test
        @DisplayName("should fail with STORAGE_FAILURE on a corrupt token record")
        void corruptToken() throws Exception {
            storage.saveToken("k", token("abc"));
            final var file = base.resolve("tokens").resolve(SecureHash.sha256Hex("k") + ".json");
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);

            final var ex = assertThrows(CredentialException.class, () -> storage.getToken("k"));

            assertEquals(Kind.STORAGE_FAILURE, ex.kind());
        }

        @Test
        @DisplayName("should fail with STORAGE_FAILURE on a record without an access token")
        void invalidToken() throws Exception {
            storage.saveToken("k", token("abc"));
            final var file = base.resolve("tokens").resolve(SecureHash.sha256Hex("k") + ".json");
            Files.writeString(file, "{\"token_type\":\"Bearer\"}", StandardCharsets.UTF_8);

            assertEquals(
                    Kind.STORAGE_FAILURE,
                    assertThrows(CredentialException.class, () -> storage.getToken("k")).kind());
        }

        @Test
        @DisplayName("should fail with STORAGE_FAILURE on an empty record")
        void emptyRecord() throws Exception {
            storage.saveToken("k", token("abc"));
            final var file = base.resolve("tokens").resolve(SecureHash.sha256Hex("k") + ".json");
            Files.writeString(file, "", StandardCharsets.UTF_8);

            assertEquals(
                    Kind.STORAGE_FAILURE,
                    assertThrows(CredentialException.class, () -> storage.getToken("k")).kind());
        }
    }

    @Test
    @DisplayName("should fail with STORAGE_FAILURE when the base directory cannot be created")
    void unusableDirectory() throws Exception {
        final var blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        final var ex = assertThrows(CredentialException.class, () -> new FileCredentialStorage(blocker.resolve("x")));

        assertEquals(Kind.STORAGE_FAILURE, ex.kind());
    }
}
