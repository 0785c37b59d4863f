package de.bsommerfeld.onova.updater;

import de.bsommerfeld.onova.io.ActivityLog;
import de.bsommerfeld.onova.io.FileOperations;
import de.bsommerfeld.onova.launch.CommandLine;
import de.bsommerfeld.onova.launch.ProcessStarter;
import de.bsommerfeld.onova.launch.UpdaterArguments;
import de.bsommerfeld.onova.launch.UpdaterSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies a staged update once the application has exited.
 *
 * <pre>
 * await writable → copy content → restart (optional) → delete staged content
 * </pre>
 *
 * There is nobody to report to once the updater runs, so {@link #run()}
 * logs every failure to the activity log and returns normally.
 */
public final class Updater {

    private final UpdaterArguments arguments;
    private final ActivityLog log;
    private final WriteAccessAwaiter awaiter;
    private final RestartTargetResolver restartTargetResolver;
    private final ProcessStarter processStarter;

    public Updater(UpdaterArguments arguments, UpdaterSettings settings, ActivityLog log,
            ProcessStarter processStarter) {
        this(arguments, log, new WriteAccessAwaiter(settings),
                new RestartTargetResolver(settings.executableFallback()), processStarter);
    }

    Updater(UpdaterArguments arguments, ActivityLog log, WriteAccessAwaiter awaiter,
            RestartTargetResolver restartTargetResolver, ProcessStarter processStarter) {
        this.arguments = arguments;
        this.log = log;
        this.awaiter = awaiter;
        this.restartTargetResolver = restartTargetResolver;
        this.processStarter = processStarter;
    }

    /** Runs the update. Never throws. */
    public void run() {
        String separator = System.lineSeparator();
        log.write("Onova Updater v" + updaterVersion() + " started with the following arguments:" + separator
                + "  UpdateeFilePath = " + arguments.updateeFile() + separator
                + "  PackageContentDirPath = " + arguments.packageContentDir() + separator
                + "  RestartUpdatee = " + arguments.restart() + separator
                + "  RoutedArgs = " + arguments.routedArguments() + separator
                + "  AdditionalExecutables = " + arguments.additionalExecutables());

        try {
            runCore();
            log.write("Update finished");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.write("Update interrupted", e);
        } catch (Exception e) {
            log.writeStackTrace(e);
        }
    }

    void runCore() throws IOException, FileStillLockedException, InterruptedException {
        Path updateeFile = arguments.updateeFile().toAbsolutePath();
        Path updateeDir = updateeFile.getParent();

        log.write("Waiting for all running updatee instances to exit...");
        awaiter.await(lockCandidates(updateeFile));

        log.write("Copying package contents from storage to updatee's directory...");
        FileOperations.copyDirectory(arguments.packageContentDir(), updateeDir);

        if (arguments.restart()) {
            restart(updateeFile, updateeDir);
        }

        log.write("Deleting package contents from storage...");
        FileOperations.deleteDirectory(arguments.packageContentDir());
    }

    private List<Path> lockCandidates(Path updateeFile) {
        List<Path> candidates = new ArrayList<>();
        candidates.add(updateeFile);
        for (Path executable : arguments.additionalExecutables()) {
            if (Files.exists(executable)) {
                candidates.add(executable);
            }
        }
        return candidates;
    }

    private void restart(Path updateeFile, Path updateeDir) throws IOException {
        List<String> command = restartTargetResolver.resolve(updateeFile,
                CommandLine.split(arguments.routedArguments()));
        log.write("Restarting updatee [" + CommandLine.join(command) + "]...");

        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(updateeDir.toFile())
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process = processStarter.start(builder);
        log.write("Restarted as pid:" + process.pid() + ".");
    }

    private static String updaterVersion() {
        String version = Updater.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }
}
