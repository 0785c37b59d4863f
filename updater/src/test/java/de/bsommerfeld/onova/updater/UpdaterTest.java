package de.bsommerfeld.onova.updater;

import de.bsommerfeld.onova.io.ActivityLog;
import de.bsommerfeld.onova.launch.ProcessStarter;
import de.bsommerfeld.onova.launch.UpdaterArguments;
import de.bsommerfeld.onova.util.Platform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class UpdaterTest {

    @TempDir
    Path tempDir;

    private Path installDir;
    private Path updateeFile;
    private Path contentDir;
    private ActivityLog log;
    private ProcessStarter processStarter;

    @BeforeEach
    void setUp() throws Exception {
        installDir = Files.createDirectories(tempDir.resolve("app"));
        updateeFile = Files.writeString(installDir.resolve("MyApp.jar"), "old");
        Files.writeString(installDir.resolve("settings.json"), "{}");

        contentDir = Files.createDirectories(tempDir.resolve("storage").resolve("1.2.0.0"));
        Files.writeString(contentDir.resolve("MyApp.jar"), "new");
        Files.createDirectories(contentDir.resolve("lib"));
        Files.writeString(contentDir.resolve("lib").resolve("dep.jar"), "dep");

        log = new ActivityLog(tempDir.resolve("storage").resolve("MyApp.Updater.Log.txt"));
        processStarter = mock(ProcessStarter.class);
        when(processStarter.start(any())).thenReturn(mock(Process.class));
    }

    @Test
    void run_shouldCopyContentAndCleanUp() throws IOException {
        updater(arguments(false, ""), file -> true).run();

        assertEquals("new", Files.readString(updateeFile));
        assertEquals("dep", Files.readString(installDir.resolve("lib").resolve("dep.jar")));
        assertEquals("{}", Files.readString(installDir.resolve("settings.json")));
        assertFalse(Files.exists(contentDir));
        verifyNoInteractions(processStarter);
    }

    @Test
    void run_shouldRestartWithRoutedArguments() throws Exception {
        updater(arguments(true, "--open \"a b.txt\""), file -> true).run();

        ArgumentCaptor<ProcessBuilder> captor = ArgumentCaptor.forClass(ProcessBuilder.class);
        verify(processStarter).start(captor.capture());
        ProcessBuilder builder = captor.getValue();
        assertEquals(List.of("java", "-jar", updateeFile.toString(), "--open", "a b.txt"), builder.command());
        assertEquals(installDir.toFile(), builder.directory());
        assertTrue(Files.readString(log.getFile()).contains("Restarted as pid:"));
    }

    @Test
    void run_shouldWaitForAdditionalExecutablesThatExist() throws IOException {
        Path helper = Files.writeString(installDir.resolve("helper"), "bin");
        Path missing = installDir.resolve("gone");
        List<Path> probed = new java.util.concurrent.CopyOnWriteArrayList<>();
        var arguments = new UpdaterArguments(updateeFile, contentDir, false, "", List.of(helper, missing));

        updater(arguments, file -> probed.add(file)).run();

        assertTrue(probed.contains(updateeFile.toAbsolutePath()));
        assertTrue(probed.contains(helper));
        assertFalse(probed.contains(missing));
    }

    @Test
    void run_shouldLogAndSwallowTimeout() throws IOException {
        var awaiter = new WriteAccessAwaiter(Duration.ofMillis(5), Duration.ofMillis(50), file -> false);
        var updater = new Updater(arguments(true, ""), log, awaiter,
                new RestartTargetResolver(Platform.LINUX, true, "java"), processStarter);

        assertDoesNotThrow(updater::run);

        String content = Files.readString(log.getFile());
        assertTrue(content.contains("FileStillLockedException"));
        assertEquals("old", Files.readString(updateeFile));
        assertTrue(Files.exists(contentDir));
        verifyNoInteractions(processStarter);
    }

    @Test
    void run_shouldLogAndSwallowMissingContent() throws IOException {
        var arguments = new UpdaterArguments(updateeFile, tempDir.resolve("missing"), true, "", List.of());

        assertDoesNotThrow(updater(arguments, file -> true)::run);

        assertTrue(Files.readString(log.getFile()).contains("NoSuchFileException"));
        verifyNoInteractions(processStarter);
    }

    @Test
    void run_shouldLogStartupArguments() throws IOException {
        updater(arguments(false, "--flag"), file -> true).run();

        String content = Files.readString(log.getFile());
        assertTrue(content.contains("Onova Updater v"));
        assertTrue(content.contains("UpdateeFilePath = " + updateeFile));
        assertTrue(content.contains("RoutedArgs = --flag"));
        assertTrue(content.contains("Update finished"));
    }

    private UpdaterArguments arguments(boolean restart, String routed) {
        return new UpdaterArguments(updateeFile, contentDir, restart, routed, List.of());
    }

    private Updater updater(UpdaterArguments arguments, java.util.function.Predicate<Path> probe) {
        return new Updater(arguments, log, new WriteAccessAwaiter(Duration.ofMillis(5), Duration.ZERO, probe),
                new RestartTargetResolver(Platform.LINUX, true, "java"), processStarter);
    }
}
