package de.bsommerfeld.onova.resolve;

import de.bsommerfeld.onova.model.Version;
import de.bsommerfeld.onova.progress.ProgressListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Combines several resolvers. Versions are the union of all sources; a
 * package is downloaded from the first source that lists its version.
 */
public final class AggregatePackageResolver implements PackageResolver {

    private final List<PackageResolver> resolvers;

    public AggregatePackageResolver(List<PackageResolver> resolvers) {
        this.resolvers = List.copyOf(resolvers);
    }

    public AggregatePackageResolver(PackageResolver... resolvers) {
        this(List.of(resolvers));
    }

    @Override
    public Set<Version> getPackageVersions() throws IOException, InterruptedException {
        Set<Version> versions = new HashSet<>();
        for (PackageResolver resolver : resolvers) {
            versions.addAll(resolver.getPackageVersions());
        }
        return versions;
    }

    @Override
    public void downloadPackage(Version version, Path destination, ProgressListener progress)
            throws IOException, InterruptedException {
        for (PackageResolver resolver : resolvers) {
            if (resolver.getPackageVersions().contains(version)) {
                resolver.downloadPackage(version, destination, progress);
                return;
            }
        }
        throw new IOException("No resolver provides version " + version);
    }
}
