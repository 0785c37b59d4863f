package de.bsommerfeld.onova.io;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.stream.Stream;

/**
 * Directory-level file operations shared by the manager and the updater.
 */
public final class FileOperations {

    private FileOperations() {
    }

    /** Deletes {@code dir} if present and recreates it empty. */
    public static void resetDirectory(Path dir) throws IOException {
        deleteDirectory(dir);
        Files.createDirectories(dir);
    }

    /** Deletes {@code dir} with all its contents. Missing directories are ignored. */
    public static void deleteDirectory(Path dir) throws IOException {
        if (Files.exists(dir)) {
            MoreFiles.deleteRecursively(dir, RecursiveDeleteOption.ALLOW_INSECURE);
        }
    }

    /**
     * Copies every file below {@code source} into {@code target}, keeping the
     * relative structure and overwriting existing files in place. Files in
     * {@code target} that have no counterpart in {@code source} are left alone.
     */
    public static void copyDirectory(Path source, Path target) throws IOException {
        Files.createDirectories(target);
        try (Stream<Path> walk = Files.walk(source)) {
            for (Path path : (Iterable<Path>) walk::iterator) {
                Path destination = target.resolve(source.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(destination);
                } else {
                    Files.copy(path, destination, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }
}
