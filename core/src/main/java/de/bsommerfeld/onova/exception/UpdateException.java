package de.bsommerfeld.onova.exception;

/**
 * Thrown when an update operation cannot proceed in the current state.
 */
public class UpdateException extends Exception {

    public UpdateException(String message) {
        super(message);
    }

    public UpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
