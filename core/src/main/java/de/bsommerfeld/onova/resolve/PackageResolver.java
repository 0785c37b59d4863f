package de.bsommerfeld.onova.resolve;

import de.bsommerfeld.onova.model.Version;
import de.bsommerfeld.onova.progress.ProgressListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Discovers published versions and fetches their packages.
 *
 * <p>
 * Implementations must either write the complete package to the destination
 * or leave no file there, so a half-written archive is never mistaken for a
 * finished download. Cancellation is signalled by interrupting the calling
 * thread and surfaces as {@link InterruptedException}.
 */
public interface PackageResolver {

    /** Returns every version available from this source. */
    Set<Version> getPackageVersions() throws IOException, InterruptedException;

    /**
     * Downloads the package of {@code version} to {@code destination}.
     *
     * @param progress receives the download fraction; may be a no-op
     * @throws IOException if the version is unknown or the transfer fails
     */
    void downloadPackage(Version version, Path destination, ProgressListener progress)
            throws IOException, InterruptedException;
}
