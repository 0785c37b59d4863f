package de.bsommerfeld.onova.launch;

import de.bsommerfeld.onova.util.Platform;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Spawns the updater jar in a separate JVM that outlives the application.
 *
 * <h3>Detachment</h3>
 * The child's output is discarded and the child is never waited on, so
 * nothing ties it to the parent once started.
 *
 * <h3>Elevation</h3>
 * When the installation directory is not writable by the current user, the
 * command is wrapped in the platform's elevation request:
 * <ul>
 * <li>Windows: {@code powershell Start-Process -Verb RunAs}</li>
 * <li>macOS: {@code osascript ... with administrator privileges}</li>
 * <li>Linux: {@code pkexec}</li>
 * </ul>
 */
public final class UpdaterProcessLauncher {

    private final Platform platform;
    private final String javaExecutable;
    private final ProcessStarter starter;

    public UpdaterProcessLauncher(Platform platform, String javaExecutable, ProcessStarter starter) {
        this.platform = platform;
        this.javaExecutable = javaExecutable;
        this.starter = starter;
    }

    public UpdaterProcessLauncher(ProcessStarter starter) {
        this(Platform.current(), Platform.current().javaExecutable(), starter);
    }

    /**
     * Starts the updater. Returns once the process exists; does not wait for
     * it to finish.
     */
    public Process launch(Path updaterJar, Path workingDir, UpdaterArguments arguments,
            UpdaterSettings settings, boolean elevated) throws IOException {
        List<String> command = buildCommand(updaterJar, arguments, settings);
        if (elevated) {
            command = elevate(command);
        }

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(workingDir.toFile());
        builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        builder.redirectError(ProcessBuilder.Redirect.DISCARD);
        return starter.start(builder);
    }

    /** {@code java -D<settings> -jar <updater> <five arguments>}. */
    public List<String> buildCommand(Path updaterJar, UpdaterArguments arguments, UpdaterSettings settings) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.addAll(settings.toSystemPropertyArguments());
        command.add("-jar");
        command.add(updaterJar.toString());
        command.addAll(arguments.toArgumentList());
        return command;
    }

    /** Wraps {@code command} in this platform's elevation request. */
    public List<String> elevate(List<String> command) {
        switch (platform) {
            case WINDOWS: {
                String script = "Start-Process -FilePath " + powershellQuote(command.get(0))
                        + " -ArgumentList " + powershellQuote(CommandLine.join(command.subList(1, command.size())))
                        + " -Verb RunAs -WindowStyle Hidden";
                return List.of("powershell.exe", "-NoProfile", "-NonInteractive",
                        "-WindowStyle", "Hidden", "-Command", script);
            }
            case MAC: {
                String shell = command.stream().map(UpdaterProcessLauncher::posixQuote)
                        .collect(Collectors.joining(" ")) + " > /dev/null 2>&1 &";
                return List.of("osascript", "-e",
                        "do shell script \"" + appleScriptEscape(shell) + "\" with administrator privileges");
            }
            default: {
                List<String> wrapped = new ArrayList<>();
                wrapped.add("pkexec");
                wrapped.addAll(command);
                return wrapped;
            }
        }
    }

    private static String powershellQuote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static String posixQuote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    private static String appleScriptEscape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
