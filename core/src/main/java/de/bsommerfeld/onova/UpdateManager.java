package de.bsommerfeld.onova;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import de.bsommerfeld.onova.config.OnovaConfig;
import de.bsommerfeld.onova.exception.LockFileNotAcquiredException;
import de.bsommerfeld.onova.exception.UpdateException;
import de.bsommerfeld.onova.exception.UpdateManagerClosedException;
import de.bsommerfeld.onova.exception.UpdateNotPreparedException;
import de.bsommerfeld.onova.exception.UpdaterAlreadyLaunchedException;
import de.bsommerfeld.onova.extract.PackageExtractor;
import de.bsommerfeld.onova.io.ActivityLog;
import de.bsommerfeld.onova.io.FileAccess;
import de.bsommerfeld.onova.io.FileOperations;
import de.bsommerfeld.onova.launch.ProcessStarter;
import de.bsommerfeld.onova.launch.UpdaterArguments;
import de.bsommerfeld.onova.launch.UpdaterBinarySource;
import de.bsommerfeld.onova.launch.UpdaterProcessLauncher;
import de.bsommerfeld.onova.launch.UpdaterSettings;
import de.bsommerfeld.onova.lock.LockFile;
import de.bsommerfeld.onova.model.AssemblyMetadata;
import de.bsommerfeld.onova.model.CheckForUpdatesResult;
import de.bsommerfeld.onova.model.Version;
import de.bsommerfeld.onova.progress.ProgressListener;
import de.bsommerfeld.onova.progress.ProgressMixer;
import de.bsommerfeld.onova.resolve.PackageResolver;
import de.bsommerfeld.onova.storage.StorageLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Entry point for updating a running application.
 *
 * <h3>Lifecycle</h3>
 *
 * <pre>
 * 1. checkForUpdates   ask the resolver which versions exist
 * 2. prepareUpdate     download, extract, materialize the updater
 * 3. launchUpdater     start the detached updater process
 * 4. (application exits; the updater copies files, restarts, cleans up)
 * </pre>
 *
 * <h3>Locking</h3>
 * The first mutating call (prepare or launch) takes an exclusive lock on
 * {@code Onova.lock} in the storage directory and keeps it until
 * {@link #close()}. A second manager for the same application, in this or any
 * other process, fails with {@link LockFileNotAcquiredException}.
 *
 * <h3>Prepared state</h3>
 * A version is prepared when its archive is gone, its content directory
 * exists and the updater jar exists. A prepare that fails half-way therefore
 * reads as "not prepared" and can simply be repeated.
 *
 * <h3>Threading</h3>
 * Blocking methods run on the caller's thread; the {@code *Async} variants run
 * on a single daemon thread owned by the manager. Cancellation is thread
 * interruption, either directly or via {@link Future#cancel(boolean)}; it is
 * never logged as a failure. Concurrent {@link #prepareUpdate} calls for the
 * same version race on the content directory and are not supported.
 *
 * <h3>Logging</h3>
 * Every operation writes to {@code {appName}.UpdateManagerLog.txt} in the
 * storage directory. Failures are logged with type and message, then rethrown.
 */
public class UpdateManager implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateManager.class);

    private static final double DOWNLOAD_WEIGHT = 0.9;
    private static final double EXTRACT_WEIGHT = 0.1;

    private final AssemblyMetadata updatee;
    private final PackageResolver resolver;
    private final PackageExtractor extractor;
    private final StorageLayout layout;
    private final UpdaterSettings updaterSettings;
    private final boolean elevationEnabled;
    private final UpdaterBinarySource updaterBinary;
    private final UpdaterProcessLauncher processLauncher;
    private final ActivityLog log;
    private final ExecutorService executor;

    private LockFile lockFile;
    private LockFile updateeLease;
    private volatile boolean closed;

    @Inject
    public UpdateManager(AssemblyMetadata updatee, PackageResolver resolver, PackageExtractor extractor,
            OnovaConfig config, UpdaterBinarySource updaterBinary, ProcessStarter processStarter) {
        this.updatee = updatee;
        this.resolver = resolver;
        this.extractor = extractor;
        this.layout = config.storageLayout(updatee.name());
        this.updaterSettings = config.updaterSettings();
        this.elevationEnabled = config.isElevationEnabled();
        this.updaterBinary = updaterBinary;
        this.processLauncher = new UpdaterProcessLauncher(processStarter);
        this.log = new ActivityLog(layout.logFile());
        this.executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("onova-" + updatee.name() + "-%d")
                .setDaemon(true)
                .build());

        log.write("UpdateManager initialized for " + updatee.name() + " " + updatee.version()
                + " (storage: " + layout.storageDir() + ")");
    }

    /**
     * Creates a manager with default configuration that materializes the
     * updater from the {@value UpdaterBinarySource#DEFAULT_RESOURCE} classpath
     * resource.
     */
    public UpdateManager(AssemblyMetadata updatee, PackageResolver resolver, PackageExtractor extractor) {
        this(updatee, resolver, extractor, new OnovaConfig(),
                UpdaterBinarySource.classpath(UpdaterBinarySource.DEFAULT_RESOURCE), ProcessStarter.DEFAULT);
    }

    public AssemblyMetadata getUpdatee() {
        return updatee;
    }

    public StorageLayout getStorageLayout() {
        return layout;
    }

    // =====================================================================
    // Operations
    // =====================================================================

    /**
     * Queries the resolver and compares the newest version against the
     * installed one.
     *
     * @throws IOException          if the resolver fails
     * @throws InterruptedException if cancelled
     */
    public CheckForUpdatesResult checkForUpdates() throws IOException, InterruptedException {
        try {
            log.write("checkForUpdates - started");
            ensureNotClosed();

            Set<Version> versions = resolver.getPackageVersions();
            CheckForUpdatesResult result = CheckForUpdatesResult.of(versions, updatee.version());

            log.write("checkForUpdates - finished: " + versions.size() + " versions, last "
                    + result.lastVersion() + ", canUpdate " + result.canUpdate());
            return result;
        } catch (IOException | RuntimeException e) {
            logFailure("checkForUpdates", e);
            throw e;
        }
    }

    /** Runs {@link #checkForUpdates()} on the manager's thread. */
    public Future<CheckForUpdatesResult> checkForUpdatesAsync() {
        ensureNotClosed();
        return executor.submit(this::checkForUpdates);
    }

    /**
     * Returns {@code true} if {@code version} is staged and ready to apply:
     * archive deleted, content directory present, updater jar present. Has no
     * side effects on the storage directory.
     */
    public boolean isUpdatePrepared(Version version) {
        try {
            ensureNotClosed();

            // Archive is deleted after extraction, so its presence means an
            // unfinished prepare
            return !Files.exists(layout.packageFile(version))
                    && Files.isDirectory(layout.packageContentDir(version))
                    && Files.isRegularFile(layout.updaterFile());
        } catch (RuntimeException e) {
            logFailure("isUpdatePrepared", e);
            throw e;
        }
    }

    /**
     * Lists every prepared version in the storage directory, ascending.
     * Directories whose name is not a version, and versions that are not
     * fully prepared, are skipped.
     */
    public List<Version> getPreparedUpdates() throws IOException {
        try {
            log.write("getPreparedUpdates - started");
            ensureNotClosed();

            if (!Files.isDirectory(layout.storageDir())) {
                return Collections.emptyList();
            }

            List<Version> result = new ArrayList<>();
            try (Stream<Path> entries = Files.list(layout.storageDir())) {
                for (Path dir : entries.filter(Files::isDirectory).collect(Collectors.toList())) {
                    Optional<Version> version = Version.tryParse(dir.getFileName().toString());
                    if (version.isPresent() && isUpdatePrepared(version.get())) {
                        result.add(version.get());
                    }
                }
            }
            Collections.sort(result);

            log.write("getPreparedUpdates - finished: " + result);
            return result;
        } catch (IOException | RuntimeException e) {
            logFailure("getPreparedUpdates", e);
            throw e;
        }
    }

    /**
     * Downloads and extracts {@code version} into the storage directory and
     * materializes the updater.
     *
     * <p>
     * The download fills the first 90% of {@code progress}, extraction the
     * remaining 10%. On failure partial state stays behind; it reads as
     * "not prepared" and is overwritten by the next attempt.
     *
     * @param progress receives overall progress; may be {@code null}
     * @throws LockFileNotAcquiredException     if another manager holds the lock
     * @throws UpdaterAlreadyLaunchedException  if an updater is still running
     * @throws IOException                      if download, extraction or
     *                                          storage access fails
     * @throws InterruptedException             if cancelled
     */
    public void prepareUpdate(Version version, ProgressListener progress)
            throws UpdateException, IOException, InterruptedException {
        try {
            log.write("prepareUpdate(" + version + ") - started");
            ensureNotClosed();
            ensureLockFileAcquired();
            ensureUpdaterNotLaunched();

            ProgressMixer mixer = progress != null ? new ProgressMixer(progress) : null;
            ProgressListener downloadProgress = mixer != null ? mixer.split(DOWNLOAD_WEIGHT) : ProgressListener.none();
            ProgressListener extractProgress = mixer != null ? mixer.split(EXTRACT_WEIGHT) : ProgressListener.none();

            Path packageFile = layout.packageFile(version);
            Path contentDir = layout.packageContentDir(version);

            Files.createDirectories(layout.storageDir());

            resolver.downloadPackage(version, packageFile, downloadProgress);
            checkInterrupted();

            FileOperations.resetDirectory(contentDir);
            extractor.extractPackage(packageFile, contentDir, extractProgress);
            checkInterrupted();

            Files.delete(packageFile);

            updaterBinary.writeTo(layout.updaterFile());

            log.write("prepareUpdate(" + version + ") - finished");
        } catch (IOException | UpdateException | RuntimeException e) {
            logFailure("prepareUpdate(" + version + ")", e);
            throw e;
        }
    }

    /** Runs {@link #prepareUpdate} on the manager's thread. */
    public Future<Void> prepareUpdateAsync(Version version, ProgressListener progress) {
        ensureNotClosed();
        return executor.submit(() -> {
            prepareUpdate(version, progress);
            return null;
        });
    }

    /**
     * Starts the updater for a prepared {@code version} and returns as soon as
     * the process exists. The application is expected to exit right after.
     *
     * @param restart           whether the updater starts the application again
     * @param restartArguments  command line for the restarted application
     * @param additionalExecutables files next to the application (relative to
     *                          its directory) that must also be released
     *                          before files are replaced
     * @throws UpdateNotPreparedException       if {@code version} is not prepared
     * @throws LockFileNotAcquiredException     if another manager holds the lock
     * @throws UpdaterAlreadyLaunchedException  if an updater is still running
     * @throws IOException                      if the process cannot be started
     */
    public void launchUpdater(Version version, boolean restart, String restartArguments,
            List<String> additionalExecutables) throws UpdateException, IOException {
        try {
            log.write("launchUpdater(" + version + ") - started");
            ensureNotClosed();
            ensureLockFileAcquired();
            ensureUpdaterNotLaunched();
            ensureUpdatePrepared(version);

            Path updateeDir = updatee.filePath().getParent();

            List<Path> executables = new ArrayList<>();
            if (additionalExecutables != null) {
                for (String executable : additionalExecutables) {
                    executables.add(updateeDir.resolve(executable).toAbsolutePath().normalize());
                }
            }

            UpdaterArguments arguments = new UpdaterArguments(updatee.filePath(),
                    layout.packageContentDir(version), restart, restartArguments, executables);

            boolean needsElevation = elevationEnabled && updateeDir != null
                    && !FileAccess.checkDirectoryWriteAccess(updateeDir);
            if (needsElevation) {
                log.write("launchUpdater - " + updateeDir + " is not writable, requesting elevation");
            }

            acquireUpdateeLease();

            log.write("launchUpdater - starting updater: " + arguments.toCommandLine());
            Process process = processLauncher.launch(layout.updaterFile(), layout.storageDir(), arguments,
                    updaterSettings, needsElevation);

            log.write("launchUpdater(" + version + ") - finished, updater pid " + process.pid());
        } catch (IOException | UpdateException | RuntimeException e) {
            logFailure("launchUpdater(" + version + ")", e);
            throw e;
        }
    }

    public void launchUpdater(Version version, boolean restart, String restartArguments)
            throws UpdateException, IOException {
        launchUpdater(version, restart, restartArguments, List.of());
    }

    /**
     * Checks for updates and, if a newer version exists, prepares it (unless
     * already prepared) and launches the updater.
     *
     * @return {@code true} if the updater was launched; the caller should exit
     */
    public boolean checkPerformUpdate(boolean restart, String restartArguments, ProgressListener progress)
            throws UpdateException, IOException, InterruptedException {
        CheckForUpdatesResult result = checkForUpdates();
        if (!result.canUpdate()) {
            return false;
        }

        Version target = result.lastVersion();
        if (!isUpdatePrepared(target)) {
            prepareUpdate(target, progress);
        }
        launchUpdater(target, restart, restartArguments);
        return true;
    }

    /**
     * Releases the storage lock and the lease on the application file and
     * stops the async thread. Idempotent.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;

        executor.shutdownNow();
        release(updateeLease);
        release(lockFile);
        updateeLease = null;
        lockFile = null;

        log.write("UpdateManager closed");
    }

    // =====================================================================
    // State Checks
    // =====================================================================

    private void ensureNotClosed() {
        if (closed) {
            throw new UpdateManagerClosedException();
        }
    }

    /**
     * Re-checks {@link #closed} under the monitor so a concurrent
     * {@link #close()} cannot leave a lock behind that nobody releases.
     */
    private synchronized void ensureLockFileAcquired() throws IOException, LockFileNotAcquiredException {
        ensureNotClosed();
        if (lockFile != null && lockFile.isValid()) {
            return;
        }
        Files.createDirectories(layout.storageDir());

        lockFile = LockFile.tryAcquire(layout.lockFile()).orElse(null);
        if (lockFile == null) {
            throw new LockFileNotAcquiredException(layout.lockFile());
        }
        LOG.debug("Acquired lock file {}", layout.lockFile());
    }

    /**
     * A running updater holds a lock on its own jar, so failing to lock the
     * jar means an updater is still at work.
     */
    private void ensureUpdaterNotLaunched() throws UpdaterAlreadyLaunchedException {
        Path updaterFile = layout.updaterFile();
        if (Files.exists(updaterFile) && !FileAccess.checkWriteAccess(updaterFile)) {
            throw new UpdaterAlreadyLaunchedException();
        }
    }

    private void ensureUpdatePrepared(Version version) throws UpdateNotPreparedException {
        if (!isUpdatePrepared(version)) {
            throw new UpdateNotPreparedException(version);
        }
    }

    /**
     * Holds a shared lock on the application file until this manager is
     * closed or the process exits. The updater waits until it can lock the
     * file exclusively, which is how it notices that the application is gone.
     */
    private synchronized void acquireUpdateeLease() {
        ensureNotClosed();
        if (updateeLease != null) {
            return;
        }
        updateeLease = LockFile.tryAcquireShared(updatee.filePath()).orElse(null);
        if (updateeLease == null) {
            LOG.warn("Could not lease {}; the updater will not wait for this process", updatee.filePath());
        }
    }

    // =====================================================================
    // Utilities
    // =====================================================================

    private void logFailure(String operation, Exception e) {
        if (!isCancellation(e)) {
            log.write(operation + " - failed", e);
        }
    }

    private static boolean isCancellation(Throwable e) {
        return e instanceof CancellationException || e instanceof ClosedByInterruptException;
    }

    private static void checkInterrupted() throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("Update preparation cancelled");
        }
    }

    private static void release(LockFile lock) {
        if (lock == null) {
            return;
        }
        try {
            lock.close();
        } catch (IOException e) {
            LOG.warn("Failed to release lock on {}", lock.getPath(), e);
        }
    }
}
