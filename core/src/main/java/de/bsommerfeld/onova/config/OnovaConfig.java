package de.bsommerfeld.onova.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.onova.launch.UpdaterSettings;
import de.bsommerfeld.onova.storage.StorageLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Update manager configuration, read from a TOML file.
 *
 * <pre>
 * storage-root = "/opt/data"            # default: platform data directory
 * archive-extension = "onv"
 * poll-interval-ms = 100
 * write-access-timeout-ms = 0           # 0 waits forever
 * elevation-enabled = true
 * executable-fallback-enabled = true
 *
 * [resolver]
 * type = "github"                       # local | web | github
 * location = "owner/repo"
 * asset-pattern = "*.onv"
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OnovaConfig {

    private static final Logger LOG = LoggerFactory.getLogger(OnovaConfig.class);

    @JsonProperty("storage-root")
    private String storageRoot;

    @JsonProperty("archive-extension")
    private String archiveExtension = StorageLayout.DEFAULT_ARCHIVE_EXTENSION;

    @JsonProperty("poll-interval-ms")
    private long pollIntervalMillis = 100;

    @JsonProperty("write-access-timeout-ms")
    private long writeAccessTimeoutMillis = 0;

    @JsonProperty("elevation-enabled")
    private boolean elevationEnabled = true;

    @JsonProperty("executable-fallback-enabled")
    private boolean executableFallbackEnabled = true;

    @JsonProperty("resolver")
    private ResolverConfig resolver = new ResolverConfig();

    /**
     * Loads the configuration at {@code path}. A missing file yields the
     * defaults; a malformed one fails.
     */
    public static OnovaConfig load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            LOG.debug("No configuration at {}, using defaults", path);
            return new OnovaConfig();
        }
        LOG.info("Loading configuration from: {}", path.toAbsolutePath());
        OnovaConfig config = new TomlMapper().readValue(path.toFile(), OnovaConfig.class);
        if (config.resolver == null) {
            config.resolver = new ResolverConfig();
        }
        return config;
    }

    /** Storage layout for {@code appName} under the configured root. */
    public StorageLayout storageLayout(String appName) {
        Path root = storageRoot != null && !storageRoot.isBlank() ? Path.of(storageRoot) : null;
        return StorageLayout.forApplication(root, appName, archiveExtension);
    }

    public UpdaterSettings updaterSettings() {
        return new UpdaterSettings(Duration.ofMillis(pollIntervalMillis),
                Duration.ofMillis(writeAccessTimeoutMillis), executableFallbackEnabled);
    }

    public String getStorageRoot() {
        return storageRoot;
    }

    public void setStorageRoot(String storageRoot) {
        this.storageRoot = storageRoot;
    }

    public String getArchiveExtension() {
        return archiveExtension;
    }

    public void setArchiveExtension(String archiveExtension) {
        this.archiveExtension = archiveExtension;
    }

    public long getPollIntervalMillis() {
        return pollIntervalMillis;
    }

    public void setPollIntervalMillis(long pollIntervalMillis) {
        this.pollIntervalMillis = pollIntervalMillis;
    }

    public long getWriteAccessTimeoutMillis() {
        return writeAccessTimeoutMillis;
    }

    public void setWriteAccessTimeoutMillis(long writeAccessTimeoutMillis) {
        this.writeAccessTimeoutMillis = writeAccessTimeoutMillis;
    }

    public boolean isElevationEnabled() {
        return elevationEnabled;
    }

    public void setElevationEnabled(boolean elevationEnabled) {
        this.elevationEnabled = elevationEnabled;
    }

    public boolean isExecutableFallbackEnabled() {
        return executableFallbackEnabled;
    }

    public void setExecutableFallbackEnabled(boolean executableFallbackEnabled) {
        this.executableFallbackEnabled = executableFallbackEnabled;
    }

    public ResolverConfig getResolver() {
        return resolver;
    }
}
