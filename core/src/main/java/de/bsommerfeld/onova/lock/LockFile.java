package de.bsommerfeld.onova.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Cross-process claim backed by an OS-level {@link FileLock}.
 *
 * <p>
 * Acquisition never blocks and never retries. The lock is released when
 * the handle is closed or when the owning process dies, since the OS drops
 * every lock held by a terminated process.
 *
 * <h3>Same-JVM behaviour</h3>
 * The JVM tracks file locks per process, so a second acquisition attempt
 * from the same JVM fails with {@link OverlappingFileLockException}. That is
 * reported as "not acquired" as well, so two managers in one process
 * exclude each other just like two processes do.
 */
public final class LockFile implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(LockFile.class);

    private final Path path;
    private final FileChannel channel;
    private final FileLock lock;

    private LockFile(Path path, FileChannel channel, FileLock lock) {
        this.path = path;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * Tries to take an exclusive lock on {@code path}, creating the file if
     * needed.
     *
     * @return the held lock, or empty if someone else holds it
     */
    public static Optional<LockFile> tryAcquire(Path path) {
        try {
            FileChannel channel = FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            return lock(path, channel, false);
        } catch (IOException e) {
            LOG.debug("Lock file {} not acquired: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Tries to take a shared lock on an existing file. Shared locks coexist
     * with each other but make every exclusive attempt fail, which is how a
     * running application advertises that its files are in use.
     */
    public static Optional<LockFile> tryAcquireShared(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
            return lock(path, channel, true);
        } catch (IOException e) {
            LOG.debug("Shared lock on {} not acquired: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<LockFile> lock(Path path, FileChannel channel, boolean shared) throws IOException {
        try {
            FileLock lock = channel.tryLock(0L, Long.MAX_VALUE, shared);
            if (lock != null) {
                return Optional.of(new LockFile(path, channel, lock));
            }
        } catch (OverlappingFileLockException e) {
            LOG.debug("Lock on {} already held inside this JVM", path);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        channel.close();
        return Optional.empty();
    }

    public Path getPath() {
        return path;
    }

    public boolean isValid() {
        return lock.isValid();
    }

    @Override
    public void close() throws IOException {
        try {
            if (lock.isValid()) {
                lock.release();
            }
        } finally {
            channel.close();
        }
    }
}
