package de.bsommerfeld.onova.launch;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Supplies the bytes of the updater jar so it can be materialized into the
 * storage directory.
 */
@FunctionalInterface
public interface UpdaterBinarySource {

    /** Classpath resource the application bundles the updater jar as. */
    String DEFAULT_RESOURCE = "/Onova.Updater.jar";

    InputStream open() throws IOException;

    /**
     * Writes the updater to {@code target}, replacing any previous copy.
     * Goes through a temporary sibling so an interrupted write never leaves a
     * truncated updater behind.
     */
    default void writeTo(Path target) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try (InputStream in = open()) {
            Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
        }
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }

    /** Reads the updater from a resource on this library's classpath. */
    static UpdaterBinarySource classpath(String resource) {
        return () -> {
            InputStream in = UpdaterBinarySource.class.getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("Updater resource not found on classpath: " + resource);
            }
            return in;
        };
    }

    /** Copies the updater from a file, e.g. a build output. */
    static UpdaterBinarySource file(Path source) {
        return () -> Files.newInputStream(source);
    }

    static UpdaterBinarySource bytes(byte[] content) {
        return () -> new ByteArrayInputStream(content);
    }
}
