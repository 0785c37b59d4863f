package de.bsommerfeld.onova.exception;

import java.nio.file.Path;

/**
 * Another process (or another manager in this process) holds the lock on the
 * application's storage directory.
 */
public class LockFileNotAcquiredException extends UpdateException {

    public LockFileNotAcquiredException(Path lockFile) {
        super("Could not acquire lock file " + lockFile
                + ". Another instance of the update manager is probably running.");
    }
}
