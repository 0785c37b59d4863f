package de.bsommerfeld.onova.updater;

import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.onova.io.FileAccess;
import de.bsommerfeld.onova.launch.UpdaterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Predicate;

/**
 * Waits until a set of files can be opened for exclusive writing, which is
 * how the updater notices that every instance of the application has exited.
 *
 * <p>
 * Each file is probed on its own thread and the caller proceeds only once
 * every probe has succeeded. With a zero timeout the wait is unbounded.
 */
public final class WriteAccessAwaiter {

    private static final Logger LOG = LoggerFactory.getLogger(WriteAccessAwaiter.class);

    private final Duration pollInterval;
    private final Duration timeout;
    private final Predicate<Path> probe;

    public WriteAccessAwaiter(UpdaterSettings settings) {
        this(settings.pollInterval(), settings.timeout(), FileAccess::checkWriteAccess);
    }

    WriteAccessAwaiter(Duration pollInterval, Duration timeout, Predicate<Path> probe) {
        this.pollInterval = pollInterval;
        this.timeout = timeout;
        this.probe = probe;
    }

    /**
     * Blocks until every file in {@code files} is writable.
     *
     * @throws FileStillLockedException if the timeout elapses first; lists the
     *                                  files still held
     * @throws InterruptedException     if interrupted while waiting
     */
    public void await(List<Path> files) throws FileStillLockedException, InterruptedException {
        if (files.isEmpty()) {
            return;
        }

        long deadline = System.nanoTime() + timeout.toNanos();

        ExecutorService executor = Executors.newFixedThreadPool(files.size(), new ThreadFactoryBuilder()
                .setNameFormat("onova-probe-%d")
                .setDaemon(true)
                .build());
        try {
            Map<Path, Future<Boolean>> probes = new LinkedHashMap<>();
            for (Path file : files) {
                probes.put(file, executor.submit(() -> awaitWritable(file, deadline)));
            }

            List<Path> stillLocked = new ArrayList<>();
            for (Map.Entry<Path, Future<Boolean>> entry : probes.entrySet()) {
                if (!join(entry.getValue())) {
                    stillLocked.add(entry.getKey());
                }
            }

            if (!stillLocked.isEmpty()) {
                throw new FileStillLockedException(stillLocked, timeout);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private boolean awaitWritable(Path file, long deadline) throws InterruptedException {
        while (!probe.test(file)) {
            if (!timeout.isZero() && System.nanoTime() - deadline >= 0) {
                LOG.warn("Gave up waiting for {}", file);
                return false;
            }
            Thread.sleep(pollInterval.toMillis());
        }
        LOG.debug("{} is writable", file);
        return true;
    }

    private static boolean join(Future<Boolean> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException) {
                throw (InterruptedException) cause;
            }
            Throwables.throwIfUnchecked(cause);
            throw new IllegalStateException("Write access probe failed", cause);
        }
    }
}
