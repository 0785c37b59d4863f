package de.bsommerfeld.onova.resolve;

import de.bsommerfeld.onova.config.ResolverConfig;

import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the resolver described by a {@code [resolver]} configuration section.
 */
public final class PackageResolvers {

    private PackageResolvers() {
    }

    /**
     * @return the configured resolver, or empty if no type is configured
     * @throws IllegalArgumentException for an unknown type or a missing location
     */
    public static Optional<PackageResolver> fromConfig(ResolverConfig config) {
        String type = config.getType() == null ? "" : config.getType().strip().toLowerCase(Locale.ROOT);
        if (type.isEmpty()) {
            return Optional.empty();
        }

        String location = config.getLocation();
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Resolver '" + type + "' requires a location");
        }

        switch (type) {
            case "local":
                return Optional.of(new LocalPackageResolver(Path.of(location), config.getAssetPattern()));
            case "web":
                return Optional.of(new WebPackageResolver(URI.create(location)));
            case "github":
                return Optional.of(new GithubPackageResolver(GitHubRepository.of(location), config.getAssetPattern()));
            default:
                throw new IllegalArgumentException("Unknown resolver type: " + config.getType());
        }
    }
}
