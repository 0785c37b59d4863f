package de.bsommerfeld.onova.io;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Write-access probes used as a proxy for "no other process is using this".
 */
public final class FileAccess {

    private FileAccess() {
    }

    /**
     * Returns {@code true} if {@code file} can be opened for writing and
     * exclusively locked right now. The file is neither truncated nor
     * modified.
     *
     * <p>
     * Windows refuses to open a running executable for writing; on other
     * platforms the lock attempt fails while another process holds a lock
     * on the file (the host's shared lease or the updater's own lock).
     */
    public static boolean checkWriteAccess(Path file) {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            FileLock lock = channel.tryLock();
            if (lock == null) {
                return false;
            }
            lock.release();
            return true;
        } catch (OverlappingFileLockException | IOException e) {
            return false;
        }
    }

    /**
     * Returns {@code true} if a file can be created in {@code dir}. Probes by
     * creating and deleting a temporary file, since permission bits alone do
     * not reflect ACLs or read-only mounts.
     */
    public static boolean checkDirectoryWriteAccess(Path dir) {
        try {
            Path probe = Files.createTempFile(dir, ".onova-", ".tmp");
            Files.deleteIfExists(probe);
            return true;
        } catch (IOException | SecurityException e) {
            return false;
        }
    }
}
