package de.bsommerfeld.onova.progress;

/**
 * Receives progress of a long-running operation as a fraction.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param fraction completed share of the work, from 0.0 to 1.0
     */
    void report(double fraction);

    /** Listener that discards every report. */
    static ProgressListener none() {
        return fraction -> {
        };
    }

    /** Returns {@code listener}, or a no-op listener if it is {@code null}. */
    static ProgressListener orNone(ProgressListener listener) {
        return listener != null ? listener : none();
    }
}
