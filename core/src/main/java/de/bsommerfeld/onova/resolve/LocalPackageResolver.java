package de.bsommerfeld.onova.resolve;

import de.bsommerfeld.onova.model.Version;
import de.bsommerfeld.onova.progress.ProgressListener;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Resolves packages from a local or network-mounted directory. Each package
 * is a file named {@code {version}.{ext}} matching the configured glob.
 */
public final class LocalPackageResolver implements PackageResolver {

    public static final String DEFAULT_PATTERN = "*.onv";

    private final Path repositoryDir;
    private final PathMatcher fileNameMatcher;

    public LocalPackageResolver(Path repositoryDir, String fileNamePattern) {
        this.repositoryDir = repositoryDir;
        this.fileNameMatcher = FileSystems.getDefault().getPathMatcher("glob:" + fileNamePattern);
    }

    public LocalPackageResolver(Path repositoryDir) {
        this(repositoryDir, DEFAULT_PATTERN);
    }

    @Override
    public Set<Version> getPackageVersions() throws IOException {
        return packageFiles().keySet();
    }

    @Override
    public void downloadPackage(Version version, Path destination, ProgressListener progress)
            throws IOException, InterruptedException {
        Path source = packageFiles().get(version);
        if (source == null) {
            throw new IOException("Package for version " + version + " not found in " + repositoryDir);
        }

        long total = Files.size(source);
        Path temp = destination.resolveSibling(destination.getFileName() + ".tmp");
        try {
            try (InputStream in = Files.newInputStream(source);
                    OutputStream out = Files.newOutputStream(temp)) {
                byte[] buffer = new byte[8192];
                long copied = 0;
                int read;
                while ((read = in.read(buffer)) != -1) {
                    if (Thread.interrupted()) {
                        throw new InterruptedException("Copy of " + source + " cancelled");
                    }
                    out.write(buffer, 0, read);
                    copied += read;
                    progress.report(total > 0 ? (double) copied / total : 1.0);
                }
            }
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private Map<Version, Path> packageFiles() throws IOException {
        Map<Version, Path> result = new LinkedHashMap<>();
        if (!Files.isDirectory(repositoryDir)) {
            return result;
        }

        try (Stream<Path> files = Files.list(repositoryDir)) {
            files.filter(Files::isRegularFile)
                    .filter(p -> fileNameMatcher.matches(p.getFileName()))
                    .forEach(p -> versionOf(p).ifPresent(v -> result.put(v, p)));
        }
        return result;
    }

    private static Optional<Version> versionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return Version.tryParse(dot > 0 ? name.substring(0, dot) : name);
    }
}
