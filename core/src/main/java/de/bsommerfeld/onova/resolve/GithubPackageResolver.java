package de.bsommerfeld.onova.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.onova.download.Downloader;
import de.bsommerfeld.onova.model.Version;
import de.bsommerfeld.onova.progress.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves packages from the releases of a GitHub repository.
 *
 * <p>
 * Every non-draft release whose tag parses as a version (an optional
 * {@code v} prefix is stripped) contributes that version, provided it has an
 * asset whose name matches the configured glob. The first matching asset
 * wins.
 *
 * <p>
 * Download URLs found by {@link #getPackageVersions()} are cached, so a
 * check followed by a prepare costs one API call.
 */
public final class GithubPackageResolver implements PackageResolver {

    private static final Logger LOG = LoggerFactory.getLogger(GithubPackageResolver.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final GitHubRepository repository;
    private final PathMatcher assetMatcher;
    private final Map<Version, URI> assetUrls = new ConcurrentHashMap<>();

    public GithubPackageResolver(GitHubRepository repository, String assetPattern) {
        this.repository = repository;
        this.assetMatcher = FileSystems.getDefault().getPathMatcher("glob:" + assetPattern);
    }

    @Override
    public Set<Version> getPackageVersions() throws IOException, InterruptedException {
        Map<Version, URI> fresh = parseReleases(Downloader.toString(repository.releasesUrl()), assetMatcher);
        assetUrls.clear();
        assetUrls.putAll(fresh);
        LOG.debug("Found {} release packages in {}", fresh.size(), repository);
        return Set.copyOf(fresh.keySet());
    }

    @Override
    public void downloadPackage(Version version, Path destination, ProgressListener progress)
            throws IOException, InterruptedException {
        if (!assetUrls.containsKey(version)) {
            getPackageVersions();
        }
        URI url = assetUrls.get(version);
        if (url == null) {
            throw new IOException("No release asset for version " + version + " in " + repository);
        }
        PackageDownloads.download(url, destination, progress);
    }

    /**
     * Maps each versioned release to the download URL of its matching asset.
     *
     * @throws IOException if the payload is not a JSON array
     */
    static Map<Version, URI> parseReleases(String json, PathMatcher assetMatcher) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || !root.isArray()) {
            throw new IOException("Unexpected GitHub releases payload");
        }

        Map<Version, URI> result = new LinkedHashMap<>();
        for (JsonNode release : root) {
            if (release.path("draft").asBoolean(false)) {
                continue;
            }

            String tag = release.path("tag_name").asText("");
            if (tag.startsWith("v") || tag.startsWith("V")) {
                tag = tag.substring(1);
            }
            var version = Version.tryParse(tag);
            if (version.isEmpty()) {
                continue;
            }

            for (JsonNode asset : release.path("assets")) {
                String name = asset.path("name").asText("");
                String url = asset.path("browser_download_url").asText("");
                if (!name.isEmpty() && !url.isEmpty() && assetMatcher.matches(Path.of(name))) {
                    result.putIfAbsent(version.get(), URI.create(url));
                    break;
                }
            }
        }
        return result;
    }
}
