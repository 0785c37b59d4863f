package de.bsommerfeld.onova.exception;

import de.bsommerfeld.onova.model.Version;

/**
 * The updater was asked to apply a version that has not been fully prepared.
 */
public class UpdateNotPreparedException extends UpdateException {

    private final Version version;

    public UpdateNotPreparedException(Version version) {
        super("Update to version " + version + " is not prepared. Call prepareUpdate first.");
        this.version = version;
    }

    public Version getVersion() {
        return version;
    }
}
