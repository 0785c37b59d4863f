package de.bsommerfeld.onova.io;

import com.google.common.base.Throwables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Append-only activity log kept next to the files it describes.
 *
 * <p>
 * Every entry is one line, {@code dd-MMM-yyyy HH:mm:ss.SSS> message}, appended
 * and flushed immediately so the file stays readable after a crash. Each entry
 * is mirrored to SLF4J.
 *
 * <p>
 * A failing log write never aborts the operation being logged; the failure is
 * reported through SLF4J instead.
 */
public final class ActivityLog {

    private static final Logger LOG = LoggerFactory.getLogger(ActivityLog.class);
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("dd-MMM-yyyy HH:mm:ss.SSS", Locale.ENGLISH);

    private final Path file;

    public ActivityLog(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    public void write(String message) {
        LOG.info(message);
        append(message);
    }

    /** Logs {@code message :: ExceptionType - exceptionMessage}. */
    public void write(String message, Throwable error) {
        String line = message + " :: " + error.getClass().getSimpleName() + " - " + error.getMessage();
        LOG.error(message, error);
        append(line);
    }

    /** Logs the full stack trace of {@code error}. */
    public void writeStackTrace(Throwable error) {
        LOG.error("Unhandled failure", error);
        append(Throwables.getStackTraceAsString(error).stripTrailing());
    }

    /** Formats one log line; package-visible for tests. */
    static String format(LocalDateTime time, String message) {
        return time.format(TIMESTAMP) + "> " + message + System.lineSeparator();
    }

    private synchronized void append(String message) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, format(LocalDateTime.now(), message), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            LOG.warn("Could not write to activity log {}: {}", file, e.getMessage());
        }
    }
}
