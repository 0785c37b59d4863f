package de.bsommerfeld.onova.exception;

/**
 * An operation was invoked on an update manager after {@code close()}.
 */
public class UpdateManagerClosedException extends IllegalStateException {

    public UpdateManagerClosedException() {
        super("UpdateManager has been closed");
    }
}
