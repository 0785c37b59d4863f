package de.bsommerfeld.onova.storage;

import de.bsommerfeld.onova.model.Version;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageLayoutTest {

    @TempDir
    Path tempDir;

    @Test
    void forApplication_shouldNamespaceUnderRoot() {
        var layout = StorageLayout.forApplication(tempDir, "MyApp", "onv");
        assertEquals(tempDir.resolve("Onova").resolve("MyApp"), layout.storageDir());
        assertEquals("MyApp", layout.appName());
    }

    @Test
    void forApplication_shouldUseDefaultRootWhenNull() {
        var layout = StorageLayout.forApplication(null, "MyApp", "onv");
        assertEquals(StorageLayout.defaultRoot().resolve("Onova").resolve("MyApp").toAbsolutePath(),
                layout.storageDir());
    }

    @Test
    void forApplication_shouldDefaultArchiveExtension() {
        var layout = StorageLayout.forApplication("MyApp");
        assertEquals("1.0.onv", layout.packageFile(Version.parse("1.0")).getFileName().toString());
    }

    @Test
    void files_shouldFollowNamingScheme() {
        var layout = StorageLayout.forApplication(tempDir, "MyApp", "zip");
        Path dir = layout.storageDir();
        Version version = Version.parse("1.2.0.0");

        assertEquals(dir.resolve("MyApp.Updater.jar"), layout.updaterFile());
        assertEquals(dir.resolve("Onova.lock"), layout.lockFile());
        assertEquals(dir.resolve("MyApp.UpdateManagerLog.txt"), layout.logFile());
        assertEquals(dir.resolve("1.2.0.0.zip"), layout.packageFile(version));
        assertEquals(dir.resolve("1.2.0.0"), layout.packageContentDir(version));
    }

    @Test
    void defaultRoot_shouldBeAbsolute() {
        assertTrue(StorageLayout.defaultRoot().isAbsolute());
    }
}
