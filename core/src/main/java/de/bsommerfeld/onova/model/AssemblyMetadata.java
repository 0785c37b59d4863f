package de.bsommerfeld.onova.model;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.jar.Attributes;
import java.util.jar.JarFile;
import java.util.jar.Manifest;

/**
 * Identity of the application being updated (the "updatee").
 *
 * @param name       storage key; the per-application storage directory is
 *                   named after it. Defaults to {@code executable}.
 * @param executable application identifier, usually the jar's
 *                   {@code Implementation-Title}
 * @param version    currently installed version
 * @param filePath   absolute path of the file that is running
 */
public record AssemblyMetadata(String name, String executable, Version version, Path filePath) {

    public AssemblyMetadata {
        Objects.requireNonNull(executable, "executable");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(filePath, "filePath");
        if (name == null || name.isBlank()) {
            name = executable;
        }
        filePath = filePath.toAbsolutePath();
    }

    public AssemblyMetadata(String executable, Version version, Path filePath) {
        this(null, executable, version, filePath);
    }

    /**
     * Reads identity from a jar manifest. {@code Implementation-Title} becomes
     * the executable id (falling back to the file name without extension) and
     * {@code Implementation-Version} the version.
     *
     * @param name optional storage key, {@code null} to use the executable id
     * @throws IOException if the jar cannot be read or declares no parsable
     *                     version
     */
    public static AssemblyMetadata fromJar(Path jar, String name) throws IOException {
        try (JarFile jarFile = new JarFile(jar.toFile())) {
            Manifest manifest = jarFile.getManifest();
            Attributes attributes = manifest != null ? manifest.getMainAttributes() : new Attributes();

            String title = attributes.getValue(Attributes.Name.IMPLEMENTATION_TITLE);
            String rawVersion = attributes.getValue(Attributes.Name.IMPLEMENTATION_VERSION);

            String executable = title != null && !title.isBlank() ? title : stripExtension(jar);
            Version version = Version.tryParse(rawVersion)
                    .orElseThrow(() -> new IOException("No parsable Implementation-Version in " + jar));
            return new AssemblyMetadata(name, executable, version, jar);
        }
    }

    /**
     * Resolves the jar that contains {@code type} and reads its manifest.
     * The usual entry point is {@code AssemblyMetadata.fromClass(Main.class, null)}.
     */
    public static AssemblyMetadata fromClass(Class<?> type, String name) throws IOException {
        var codeSource = type.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            throw new IOException("No code source for " + type.getName());
        }
        try {
            return fromJar(Path.of(codeSource.getLocation().toURI()), name);
        } catch (URISyntaxException e) {
            throw new IOException("Invalid code source location for " + type.getName(), e);
        }
    }

    private static String stripExtension(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
