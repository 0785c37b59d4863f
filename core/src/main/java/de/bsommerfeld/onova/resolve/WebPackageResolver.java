package de.bsommerfeld.onova.resolve;

import de.bsommerfeld.onova.download.Downloader;
import de.bsommerfeld.onova.model.Version;
import de.bsommerfeld.onova.progress.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolves packages from a plain-text manifest served over HTTP.
 *
 * <pre>
 * # version  package URL (absolute, or relative to the manifest)
 * 1.0.0.0    https://example.com/app/1.0.0.0.onv
 * 1.2.0.0    1.2.0.0.onv
 * </pre>
 *
 * Blank lines, {@code #} comments and lines without a parsable version are
 * ignored.
 */
public final class WebPackageResolver implements PackageResolver {

    private static final Logger LOG = LoggerFactory.getLogger(WebPackageResolver.class);

    private final URI manifestUrl;

    public WebPackageResolver(URI manifestUrl) {
        this.manifestUrl = manifestUrl;
    }

    @Override
    public Set<Version> getPackageVersions() throws IOException, InterruptedException {
        return fetchManifest().keySet();
    }

    @Override
    public void downloadPackage(Version version, Path destination, ProgressListener progress)
            throws IOException, InterruptedException {
        URI packageUrl = fetchManifest().get(version);
        if (packageUrl == null) {
            throw new IOException("Package for version " + version + " not listed in " + manifestUrl);
        }
        PackageDownloads.download(packageUrl, destination, progress);
    }

    private Map<Version, URI> fetchManifest() throws IOException, InterruptedException {
        return parseManifest(Downloader.toString(manifestUrl), manifestUrl);
    }

    static Map<Version, URI> parseManifest(String manifest, URI base) {
        Map<Version, URI> result = new LinkedHashMap<>();
        for (String rawLine : manifest.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            String[] parts = line.split("\\s+", 2);
            if (parts.length != 2) {
                LOG.debug("Skipping manifest line without URL: {}", line);
                continue;
            }
            Version.tryParse(parts[0]).ifPresentOrElse(
                    version -> result.put(version, base.resolve(parts[1].strip())),
                    () -> LOG.debug("Skipping manifest line with invalid version: {}", line));
        }
        return result;
    }
}
