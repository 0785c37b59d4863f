package de.bsommerfeld.onova.launch;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The positional argument contract between the update manager and the
 * updater process.
 *
 * <pre>
 * &lt;updateeFilePath&gt; &lt;packageContentDirPath&gt; &lt;restart&gt; &lt;routedArgsBase64&gt; &lt;additionalExecutablesBase64&gt;
 * </pre>
 *
 * The restart arguments and the {@code ;}-joined list of additional
 * executables travel Base64-encoded (UTF-8) so no quoting layer between the
 * two processes can alter them.
 *
 * @param updateeFile           file of the running application
 * @param packageContentDir     staged content to copy over the installation
 * @param restart               whether to start the application afterwards
 * @param routedArguments       command line to pass to the restarted
 *                              application, never {@code null}
 * @param additionalExecutables absolute paths of further files the
 *                              application runs from
 */
public record UpdaterArguments(Path updateeFile, Path packageContentDir, boolean restart,
        String routedArguments, List<Path> additionalExecutables) {

    public static final int ARGUMENT_COUNT = 5;

    private static final char PATH_SEPARATOR = ';';

    public UpdaterArguments {
        Objects.requireNonNull(updateeFile, "updateeFile");
        Objects.requireNonNull(packageContentDir, "packageContentDir");
        routedArguments = routedArguments != null ? routedArguments : "";
        additionalExecutables = additionalExecutables != null ? List.copyOf(additionalExecutables) : List.of();
    }

    /** Renders the five positional arguments. */
    public List<String> toArgumentList() {
        String executables = Joiner.on(PATH_SEPARATOR).join(additionalExecutables);
        return List.of(
                updateeFile.toString(),
                packageContentDir.toString(),
                Boolean.toString(restart),
                encode(routedArguments),
                encode(executables));
    }

    /** Renders the arguments as a single quoted command line string. */
    public String toCommandLine() {
        return CommandLine.join(toArgumentList());
    }

    /**
     * Decodes the argument vector received by the updater's {@code main}.
     *
     * @throws IllegalArgumentException if the count, the boolean or the
     *                                  Base64 payloads are malformed
     */
    public static UpdaterArguments parse(String[] args) {
        if (args.length != ARGUMENT_COUNT) {
            throw new IllegalArgumentException(
                    "Expected " + ARGUMENT_COUNT + " arguments, got " + args.length);
        }

        String restartFlag = args[2].toLowerCase(Locale.ROOT);
        if (!restartFlag.equals("true") && !restartFlag.equals("false")) {
            throw new IllegalArgumentException("Restart flag must be true or false, got: " + args[2]);
        }

        List<Path> executables = Splitter.on(PATH_SEPARATOR)
                .omitEmptyStrings()
                .splitToStream(decode(args[4]))
                .map(Path::of)
                .collect(Collectors.toList());

        return new UpdaterArguments(
                Path.of(args[0]),
                Path.of(args[1]),
                Boolean.parseBoolean(restartFlag),
                decode(args[3]),
                executables);
    }

    static String encode(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    static String decode(String value) {
        return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
    }
}
