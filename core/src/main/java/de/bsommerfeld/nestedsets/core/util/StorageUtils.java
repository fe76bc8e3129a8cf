package de.bsommerfeld.nestedsets.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Default on-disk locations: the SQLite database file and {@code config.toml}
 * both live in the platform's data directory for {@link #APP_NAME}.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/nested-sets}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\nested-sets}, else
 * {@code ~/AppData/Roaming/nested-sets}</li>
 * <li><strong>Linux and others</strong>: {@code $XDG_DATA_HOME/nested-sets}
 * if that is an absolute path, else {@code ~/.local/share/nested-sets}</li>
 * </ul>
 *
 * Nothing here creates directories; the connection factory and the
 * configuration loader create the parent they need.
 */
public final class StorageUtils {

    public static final String APP_NAME = "nested-sets";
    public static final String DATABASE_FILE = "nested-sets.db";
    public static final String CONFIG_FILE = "config.toml";

    private StorageUtils() {
    }

    public static Path getAppDataDir() {
        return resolveAppDataDir(System.getProperty("os.name", "generic"), System::getenv,
                System.getProperty("user.home"));
    }

    public static Path getDatabaseFile() {
        return getAppDataDir().resolve(DATABASE_FILE);
    }

    public static Path getConfigFile() {
        return getAppDataDir().resolve(CONFIG_FILE);
    }

    /**
     * Platform rules behind {@link #getAppDataDir()}, with the environment
     * passed in.
     *
     * @param osName   value of {@code os.name}
     * @param env      environment lookup, returning {@code null} for unset keys
     * @param userHome value of {@code user.home}
     */
    static Path resolveAppDataDir(String osName, UnaryOperator<String> env, String userHome) {
        String os = osName.toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(userHome, "Library", "Application Support", APP_NAME);
        }
        if (os.contains("win")) {
            String appData = env.apply("APPDATA");
            if (appData != null && !appData.isEmpty()) {
                return Paths.get(appData, APP_NAME);
            }
            return Paths.get(userHome, "AppData", "Roaming", APP_NAME);
        }

        // relative XDG paths are invalid and ignored
        String xdgData = env.apply("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty() && Paths.get(xdgData).isAbsolute()) {
            return Paths.get(xdgData, APP_NAME);
        }
        return Paths.get(userHome, ".local", "share", APP_NAME);
    }
}
