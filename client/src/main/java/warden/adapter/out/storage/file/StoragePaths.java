package warden.adapter.out.storage.file;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Locale;
import java.util.Map;

/**
 * Platform default locations for file-backed storage.
 *
 * <ul>
 *   <li>Linux and other Unix: {@code $XDG_DATA_HOME/<app>}, else {@code ~/.local/share/<app>}</li>
 *   <li>macOS: {@code ~/Library/Application Support/<app>}</li>
 *   <li>Windows: {@code %LOCALAPPDATA%\<app>}</li>
 *   <li>fallback: {@code <java.io.tmpdir>/<app>}</li>
 * </ul>
 */
public final class StoragePaths {

    private static final String OWNER_ONLY_DIR = "rwx------";

    private StoragePaths() {}

    public static Path defaultDataDirectory(String appName) {
        return defaultDataDirectory(
                appName,
                System.getProperty("os.name", ""),
                System.getProperty("user.home"),
                System.getProperty("java.io.tmpdir"),
                System.getenv());
    }

    static Path defaultDataDirectory(
            String appName, String osName, String userHome, String tmpDir, Map<String, String> env) {
        validateAppName(appName);
        final var os = osName.toLowerCase(Locale.ROOT);

        if (os.contains("win")) {
            final var localAppData = env.get("LOCALAPPDATA");
            if (isSet(localAppData)) {
                return Path.of(localAppData, appName);
            }
        } else if (os.contains("mac") || os.contains("darwin")) {
            if (isSet(userHome)) {
                return Path.of(userHome, "Library", "Application Support", appName);
            }
        } else {
            final var xdgDataHome = env.get("XDG_DATA_HOME");
            if (isSet(xdgDataHome)) {
                return Path.of(xdgDataHome, appName);
            }
            if (isSet(userHome)) {
                return Path.of(userHome, ".local", "share", appName);
            }
        }
        return Path.of(tmpDir, appName);
    }

    /**
     * Create {@code directory} and any missing parents, owner-only where the
     * file system supports POSIX permissions.
     */
    static void createPrivateDirectories(Path directory) throws IOException {
        if (Files.isDirectory(directory)) {
            return;
        }
        if (supportsPosix(directory)) {
            try {
                Files.createDirectories(
                        directory,
                        PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString(OWNER_ONLY_DIR)));
            } catch (FileAlreadyExistsException e) {
                if (!Files.isDirectory(directory)) {
                    throw e;
                }
            }
        } else {
            Files.createDirectories(directory);
        }
    }

    static boolean supportsPosix(Path path) {
        return path.getFileSystem().supportedFileAttributeViews().contains("posix");
    }

    private static void validateAppName(String appName) {
        if (appName == null || appName.isBlank()) {
            throw new IllegalArgumentException("appName must not be null or blank");
        }
        if (appName.contains("/") || appName.contains("\\") || appName.equals("..") || appName.equals(".")) {
            throw new IllegalArgumentException("appName must be a single path segment: " + appName);
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
