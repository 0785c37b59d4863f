package de.bsommerfeld.onova.updater;

import de.bsommerfeld.onova.exception.UpdateException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Thrown when files are still held by another process after the configured
 * wait timeout.
 */
public class FileStillLockedException extends UpdateException {

    private final List<Path> files;

    public FileStillLockedException(List<Path> files, Duration timeout) {
        super("Files still locked after " + timeout.toMillis() + " ms: " + files);
        this.files = List.copyOf(files);
    }

    public List<Path> getFiles() {
        return files;
    }
}
