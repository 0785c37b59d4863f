package de.bsommerfeld.onova.launch;

import java.io.IOException;

/**
 * Starts a configured process. Exists so process creation can be observed
 * and replaced in tests.
 */
@FunctionalInterface
public interface ProcessStarter {

    ProcessStarter DEFAULT = ProcessBuilder::start;

    Process start(ProcessBuilder builder) throws IOException;
}
