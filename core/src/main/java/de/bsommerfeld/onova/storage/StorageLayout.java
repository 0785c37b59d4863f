package de.bsommerfeld.onova.storage;

import de.bsommerfeld.onova.model.Version;
import de.bsommerfeld.onova.util.Platform;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Paths inside the per-application storage directory.
 *
 * <pre>
 * {root}/Onova/{appName}/
 *   {appName}.Updater.jar           materialized updater
 *   {appName}.UpdateManagerLog.txt  manager activity log
 *   Onova.lock                      exclusive lock file
 *   {version}.{ext}                 downloaded archive, transient
 *   {version}/                      extracted package content
 * </pre>
 *
 * <p>
 * Nothing here touches the file system; callers create directories as needed.
 */
public final class StorageLayout {

    public static final String NAMESPACE = "Onova";
    public static final String LOCK_FILE_NAME = "Onova.lock";
    public static final String DEFAULT_ARCHIVE_EXTENSION = "onv";

    private final Path storageDir;
    private final String appName;
    private final String archiveExtension;

    public StorageLayout(Path storageDir, String appName, String archiveExtension) {
        this.storageDir = storageDir.toAbsolutePath();
        this.appName = appName;
        this.archiveExtension = archiveExtension;
    }

    /** Layout under the platform's default data directory. */
    public static StorageLayout forApplication(String appName) {
        return new StorageLayout(defaultRoot().resolve(NAMESPACE).resolve(appName), appName,
                DEFAULT_ARCHIVE_EXTENSION);
    }

    /**
     * Layout under an explicit root; {@code null} selects
     * {@link #defaultRoot()}.
     */
    public static StorageLayout forApplication(Path root, String appName, String archiveExtension) {
        Path base = root != null ? root : defaultRoot();
        return new StorageLayout(base.resolve(NAMESPACE).resolve(appName), appName, archiveExtension);
    }

    /**
     * Per-user, machine-local application data directory:
     * <ul>
     * <li>Windows: {@code %LOCALAPPDATA%}, then {@code %APPDATA%}, then
     * {@code ~/AppData/Local}</li>
     * <li>macOS: {@code ~/Library/Application Support}</li>
     * <li>Linux: {@code $XDG_DATA_HOME}, then {@code ~/.local/share}</li>
     * </ul>
     */
    public static Path defaultRoot() {
        String home = System.getProperty("user.home");
        switch (Platform.current()) {
            case WINDOWS: {
                String localAppData = System.getenv("LOCALAPPDATA");
                if (localAppData != null && !localAppData.isBlank())
                    return Paths.get(localAppData);
                String appData = System.getenv("APPDATA");
                if (appData != null && !appData.isBlank())
                    return Paths.get(appData);
                return Paths.get(home, "AppData", "Local");
            }
            case MAC:
                return Paths.get(home, "Library", "Application Support");
            default: {
                String xdgData = System.getenv("XDG_DATA_HOME");
                if (xdgData != null && !xdgData.isBlank())
                    return Paths.get(xdgData);
                return Paths.get(home, ".local", "share");
            }
        }
    }

    public Path storageDir() {
        return storageDir;
    }

    public String appName() {
        return appName;
    }

    public Path updaterFile() {
        return storageDir.resolve(appName + ".Updater.jar");
    }

    public Path lockFile() {
        return storageDir.resolve(LOCK_FILE_NAME);
    }

    public Path logFile() {
        return storageDir.resolve(appName + ".UpdateManagerLog.txt");
    }

    public Path packageFile(Version version) {
        return storageDir.resolve(version + "." + archiveExtension);
    }

    public Path packageContentDir(Version version) {
        return storageDir.resolve(version.toString());
    }
}
