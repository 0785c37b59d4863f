package de.bsommerfeld.onova.extract;

import de.bsommerfeld.onova.progress.ProgressListener;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Unpacks a downloaded package.
 *
 * <p>
 * The destination directory exists and is empty when called. An
 * implementation must either populate it completely or fail.
 */
public interface PackageExtractor {

    void extractPackage(Path sourceFile, Path destinationDir, ProgressListener progress)
            throws IOException, InterruptedException;
}
