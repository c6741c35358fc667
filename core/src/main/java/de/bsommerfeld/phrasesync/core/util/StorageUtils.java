package de.bsommerfeld.phrasesync.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves OS-specific application data directories following each platform's
 * native conventions. Paths are absolute but <strong>not</strong> created; the
 * caller is responsible for ensuring the directory exists.
 *
 * <p>
 * Resolution order per platform:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 * The {@code phrasesync.home} system property overrides all of the above.
 */
public final class StorageUtils {

    public static final String APP_NAME = "phrase-sync";
    static final String HOME_OVERRIDE = "phrasesync.home";

    private StorageUtils() {
    }

    public static Path getAppDataDir() {
        String override = System.getProperty(HOME_OVERRIDE);
        if (override != null && !override.isBlank()) {
            return Paths.get(override).toAbsolutePath();
        }
        return getAppDataDir(APP_NAME);
    }

    /**
     * Returns the platform-specific application data directory for the given app
     * name. The directory is not guaranteed to exist.
     */
    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        Path path;

        if ((os.contains("mac")) || (os.contains("darwin"))) {
            path = Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        } else if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null) {
                path = Paths.get(appData, appName);
            } else {
                path = Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
            }
        } else {
            String xdgData = System.getenv("XDG_DATA_HOME");
            if (xdgData != null && !xdgData.isEmpty()) {
                path = Paths.get(xdgData, appName);
            } else {
                path = Paths.get(System.getProperty("user.home"), ".local", "share", appName);
            }
        }
        return path;
    }

    public static Path getLogsDir() {
        return getAppDataDir().resolve("logs");
    }

    /**
     * Resolves a configured path: absolute paths are returned as-is, relative
     * ones are placed inside the application data directory.
     */
    public static Path resolveInAppData(String configured) {
        Path p = Paths.get(configured);
        return p.isAbsolute() ? p : getAppDataDir().resolve(p);
    }
}
