package de.bsommerfeld.onova.launch;

import de.bsommerfeld.onova.util.Platform;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class UpdaterProcessLauncherTest {

    @TempDir
    Path tempDir;

    private final UpdaterArguments arguments = new UpdaterArguments(
            Path.of("/opt/app/MyApp.jar"), Path.of("/data/Onova/MyApp/1.2.0.0"), true, "--x", List.of());

    @Test
    void buildCommand_shouldPlaceSettingsBeforeJar() {
        var launcher = new UpdaterProcessLauncher(Platform.LINUX, "/usr/bin/java", ProcessStarter.DEFAULT);
        Path jar = Path.of("/data/Onova/MyApp/MyApp.Updater.jar");

        List<String> command = launcher.buildCommand(jar, arguments, UpdaterSettings.DEFAULT);

        assertEquals("/usr/bin/java", command.get(0));
        assertTrue(command.get(1).startsWith("-D" + UpdaterSettings.POLL_INTERVAL_KEY));
        int jarFlag = command.indexOf("-jar");
        assertEquals(4, jarFlag);
        assertEquals(jar.toString(), command.get(jarFlag + 1));
        assertEquals(arguments.toArgumentList(), command.subList(jarFlag + 2, command.size()));
    }

    @Test
    void launch_shouldStartDetachedProcessInWorkingDirectory() throws Exception {
        ProcessStarter starter = mock(ProcessStarter.class);
        when(starter.start(any())).thenReturn(mock(Process.class));
        var launcher = new UpdaterProcessLauncher(Platform.LINUX, "java", starter);
        Path jar = tempDir.resolve("MyApp.Updater.jar");

        launcher.launch(jar, tempDir, arguments, UpdaterSettings.DEFAULT, false);

        ArgumentCaptor<ProcessBuilder> captor = ArgumentCaptor.forClass(ProcessBuilder.class);
        verify(starter).start(captor.capture());
        ProcessBuilder builder = captor.getValue();
        assertEquals(launcher.buildCommand(jar, arguments, UpdaterSettings.DEFAULT), builder.command());
        assertEquals(tempDir.toFile(), builder.directory());
        assertEquals(ProcessBuilder.Redirect.DISCARD, builder.redirectOutput());
    }

    @Test
    void launch_shouldWrapElevatedCommand() throws Exception {
        ProcessStarter starter = mock(ProcessStarter.class);
        when(starter.start(any())).thenReturn(mock(Process.class));
        var launcher = new UpdaterProcessLauncher(Platform.LINUX, "java", starter);

        launcher.launch(tempDir.resolve("u.jar"), tempDir, arguments, UpdaterSettings.DEFAULT, true);

        ArgumentCaptor<ProcessBuilder> captor = ArgumentCaptor.forClass(ProcessBuilder.class);
        verify(starter).start(captor.capture());
        assertEquals("pkexec", captor.getValue().command().get(0));
        assertEquals("java", captor.getValue().command().get(1));
    }

    @Test
    void elevate_shouldUseRunAsOnWindows() {
        var launcher = new UpdaterProcessLauncher(Platform.WINDOWS, "java.exe", ProcessStarter.DEFAULT);

        List<String> command = launcher.elevate(List.of("C:\\jre\\bin\\java.exe", "-jar", "C:\\it's\\u.jar"));

        assertEquals("powershell.exe", command.get(0));
        String script = command.get(command.size() - 1);
        assertTrue(script.startsWith("Start-Process -FilePath 'C:\\jre\\bin\\java.exe'"));
        assertTrue(script.contains("it''s"));
        assertTrue(script.contains("-Verb RunAs"));
    }

    @Test
    void elevate_shouldUseAdministratorPrivilegesOnMac() {
        var launcher = new UpdaterProcessLauncher(Platform.MAC, "java", ProcessStarter.DEFAULT);

        List<String> command = launcher.elevate(List.of("java", "-jar", "/Users/me/u.jar"));

        assertEquals("osascript", command.get(0));
        assertTrue(command.get(2).contains("'/Users/me/u.jar'"));
        assertTrue(command.get(2).endsWith("with administrator privileges"));
    }
}
