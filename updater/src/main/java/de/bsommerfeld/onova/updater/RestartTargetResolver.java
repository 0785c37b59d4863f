package de.bsommerfeld.onova.updater;

import com.google.common.io.MoreFiles;
import de.bsommerfeld.onova.util.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides how the application is started again after an update.
 *
 * <ol>
 * <li>A native executable ({@code .exe} on Windows, a file without extension
 * elsewhere) is started directly.</li>
 * <li>Otherwise, if enabled, a native executable with the same base name in
 * the same directory is started instead. On POSIX it must be executable.</li>
 * <li>Otherwise the file runs on the current Java runtime: {@code java -jar}
 * for jars, {@code java <file>} for anything else.</li>
 * </ol>
 *
 * On Windows the command is wrapped in {@code cmd /c start} so the restarted
 * application gets its own console. Every word after {@code start ""} is
 * quoted for the C runtime and caret-escaped for {@code cmd}, so arguments
 * containing {@code & | < > ( ) ^} reach the application unchanged.
 */
public final class RestartTargetResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RestartTargetResolver.class);

    private static final String CMD_METACHARACTERS = "&|<>()^";

    private final Platform platform;
    private final boolean executableFallback;
    private final String javaExecutable;

    public RestartTargetResolver(Platform platform, boolean executableFallback, String javaExecutable) {
        this.platform = platform;
        this.executableFallback = executableFallback;
        this.javaExecutable = javaExecutable;
    }

    public RestartTargetResolver(boolean executableFallback) {
        this(Platform.current(), executableFallback, Platform.current().javaExecutable());
    }

    /**
     * @return the full command that restarts {@code updateeFile} with
     *         {@code arguments}
     */
    public List<String> resolve(Path updateeFile, List<String> arguments) {
        List<String> words = new ArrayList<>(target(updateeFile));
        words.addAll(arguments);
        if (platform != Platform.WINDOWS) {
            return words;
        }

        List<String> command = new ArrayList<>(List.of("cmd.exe", "/c", "start", "\"\""));
        for (String word : words) {
            command.add(escapeForCmd(word));
        }
        return command;
    }

    /**
     * Quotes {@code word} the way the Windows C runtime splits command lines,
     * then puts a caret before every {@code cmd} metacharacter left outside a
     * quoted section. The result starts and ends with a quote, which
     * {@link ProcessBuilder} passes through as is.
     */
    static String escapeForCmd(String word) {
        StringBuilder quoted = new StringBuilder("\"");
        int backslashes = 0;
        for (char c : word.toCharArray()) {
            if (c == '\\') {
                backslashes++;
                continue;
            }
            if (c == '"') {
                quoted.append("\\".repeat(backslashes * 2 + 1));
            } else {
                quoted.append("\\".repeat(backslashes));
            }
            quoted.append(c);
            backslashes = 0;
        }
        quoted.append("\\".repeat(backslashes * 2)).append('"');

        // cmd toggles its quote state on every quote, escaped for the runtime or not
        StringBuilder escaped = new StringBuilder(quoted.length());
        boolean insideQuotes = false;
        for (char c : quoted.toString().toCharArray()) {
            if (c == '"') {
                insideQuotes = !insideQuotes;
            } else if (!insideQuotes && CMD_METACHARACTERS.indexOf(c) >= 0) {
                escaped.append('^');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    List<String> target(Path updateeFile) {
        if (isNativeExecutable(updateeFile)) {
            return List.of(updateeFile.toString());
        }

        if (executableFallback) {
            Optional<Path> sibling = nativeSibling(updateeFile);
            if (sibling.isPresent()) {
                LOG.info("Restarting native sibling {} instead of {}", sibling.get(), updateeFile);
                return List.of(sibling.get().toString());
            }
        }

        if (MoreFiles.getFileExtension(updateeFile).toLowerCase(Locale.ROOT).equals("jar")) {
            return List.of(javaExecutable, "-jar", updateeFile.toString());
        }
        return List.of(javaExecutable, updateeFile.toString());
    }

    private boolean isNativeExecutable(Path file) {
        String extension = MoreFiles.getFileExtension(file);
        return ("." + extension).equalsIgnoreCase(platform.nativeExecutableExtension())
                || extension.isEmpty() && platform.nativeExecutableExtension().isEmpty();
    }

    private Optional<Path> nativeSibling(Path updateeFile) {
        Path dir = updateeFile.toAbsolutePath().getParent();
        if (dir == null) {
            return Optional.empty();
        }

        Path sibling = dir.resolve(MoreFiles.getNameWithoutExtension(updateeFile)
                + platform.nativeExecutableExtension());
        if (sibling.equals(updateeFile.toAbsolutePath())) {
            return Optional.empty();
        }
        if (!Files.isRegularFile(sibling) || !sibling.getParent().equals(dir)) {
            return Optional.empty();
        }
        if (platform != Platform.WINDOWS && !Files.isExecutable(sibling)) {
            LOG.warn("Ignoring {}: not executable", sibling);
            return Optional.empty();
        }
        return Optional.of(sibling);
    }
}
