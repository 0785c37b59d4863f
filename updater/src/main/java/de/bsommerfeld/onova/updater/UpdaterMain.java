package de.bsommerfeld.onova.updater;

import com.google.common.io.MoreFiles;
import de.bsommerfeld.onova.io.ActivityLog;
import de.bsommerfeld.onova.launch.ProcessStarter;
import de.bsommerfeld.onova.launch.UpdaterArguments;
import de.bsommerfeld.onova.launch.UpdaterSettings;
import de.bsommerfeld.onova.lock.LockFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Updater process entry point.
 *
 * <p>
 * Started detached by the update manager with the five positional arguments
 * of {@link UpdaterArguments} and its settings as system properties. Writes
 * {@code {jarBaseName}.Log.txt} next to its own jar.
 *
 * <h3>Exit codes</h3>
 * {@code 1} if the arguments cannot be parsed, {@code 0} otherwise, whatever
 * the outcome of the update. Failures are only visible in the log.
 */
public final class UpdaterMain {

    private static final Logger LOG = LoggerFactory.getLogger(UpdaterMain.class);

    private static final String DEFAULT_BASE_NAME = "Onova.Updater";

    private UpdaterMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, locateSelf()));
    }

    static int run(String[] args, Path self) {
        ActivityLog log = new ActivityLog(logFileFor(self));

        UpdaterArguments arguments;
        try {
            arguments = UpdaterArguments.parse(args);
        } catch (IllegalArgumentException e) {
            log.write("Invalid arguments", e);
            return 1;
        }
        UpdaterSettings settings = UpdaterSettings.fromSystemProperties(System.getProperties());

        // Holding our own jar lets the manager see that an updater is running
        Optional<LockFile> selfLock = Files.isRegularFile(self) ? LockFile.tryAcquire(self) : Optional.empty();
        if (Files.isRegularFile(self) && selfLock.isEmpty()) {
            log.write("Another updater is already running from " + self + ", exiting");
            return 0;
        }

        try {
            new Updater(arguments, settings, log, ProcessStarter.DEFAULT).run();
        } finally {
            selfLock.ifPresent(UpdaterMain::release);
        }
        return 0;
    }

    static Path logFileFor(Path self) {
        if (Files.isDirectory(self)) {
            return self.resolve(DEFAULT_BASE_NAME + ".Log.txt");
        }
        Path dir = self.toAbsolutePath().getParent();
        return dir.resolve(MoreFiles.getNameWithoutExtension(self) + ".Log.txt");
    }

    private static Path locateSelf() {
        try {
            return Path.of(UpdaterMain.class.getProtectionDomain().getCodeSource().getLocation().toURI());
        } catch (URISyntaxException | SecurityException e) {
            LOG.warn("Could not locate updater jar, logging to working directory", e);
            return Path.of("").toAbsolutePath();
        }
    }

    private static void release(LockFile lock) {
        try {
            lock.close();
        } catch (IOException e) {
            LOG.warn("Failed to release lock on {}", lock.getPath(), e);
        }
    }
}
