package de.bsommerfeld.onova.exception;

/**
 * The updater process started by a previous launch is still running.
 */
public class UpdaterAlreadyLaunchedException extends UpdateException {

    public UpdaterAlreadyLaunchedException() {
        super("Updater has already been launched, either by this or another instance of the application.");
    }
}
