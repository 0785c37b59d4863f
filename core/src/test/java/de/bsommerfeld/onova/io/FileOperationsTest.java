package de.bsommerfeld.onova.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileOperationsTest {

    @TempDir
    Path tempDir;

    @Test
    void resetDirectory_shouldLeaveEmptyDirectory() throws IOException {
        Path dir = tempDir.resolve("1.2.0.0");
        Files.createDirectories(dir.resolve("nested"));
        Files.writeString(dir.resolve("nested").resolve("old.txt"), "old");

        FileOperations.resetDirectory(dir);

        assertTrue(Files.isDirectory(dir));
        try (var entries = Files.list(dir)) {
            assertEquals(0, entries.count());
        }
    }

    @Test
    void resetDirectory_shouldCreateMissingDirectory() throws IOException {
        Path dir = tempDir.resolve("fresh");
        FileOperations.resetDirectory(dir);
        assertTrue(Files.isDirectory(dir));
    }

    @Test
    void deleteDirectory_shouldIgnoreMissingDirectory() {
        assertDoesNotThrow(() -> FileOperations.deleteDirectory(tempDir.resolve("missing")));
    }

    @Test
    void deleteDirectory_shouldRemoveTree() throws IOException {
        Path dir = tempDir.resolve("tree");
        Files.createDirectories(dir.resolve("a").resolve("b"));
        Files.writeString(dir.resolve("a").resolve("b").resolve("file.txt"), "x");

        FileOperations.deleteDirectory(dir);

        assertFalse(Files.exists(dir));
    }

    @Test
    void copyDirectory_shouldOverwriteAndKeepUnrelatedFiles() throws IOException {
        Path source = tempDir.resolve("source");
        Path target = tempDir.resolve("target");
        Files.createDirectories(source.resolve("lib"));
        Files.createDirectories(target.resolve("lib"));
        Files.writeString(source.resolve("app.jar"), "new app");
        Files.writeString(source.resolve("lib").resolve("dep.jar"), "new dep");
        Files.writeString(target.resolve("app.jar"), "old app");
        Files.writeString(target.resolve("lib").resolve("extra.jar"), "extra");

        FileOperations.copyDirectory(source, target);

        assertEquals("new app", Files.readString(target.resolve("app.jar")));
        assertEquals("new dep", Files.readString(target.resolve("lib").resolve("dep.jar")));
        assertEquals("extra", Files.readString(target.resolve("lib").resolve("extra.jar")));
    }

    @Test
    void copyDirectory_shouldFailForMissingSource() {
        assertThrows(IOException.class,
                () -> FileOperations.copyDirectory(tempDir.resolve("missing"), tempDir.resolve("target")));
    }
}
