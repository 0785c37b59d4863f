package de.bsommerfeld.onova.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Operating system detection and the few OS-specific names the updater needs.
 */
public enum Platform {

    WINDOWS, MAC, LINUX;

    /** Detects the platform from the {@code os.name} system property. */
    public static Platform current() {
        return detect(System.getProperty("os.name", "generic"));
    }

    static Platform detect(String osName) {
        String os = osName.toLowerCase(Locale.ENGLISH);
        // "darwin" contains "win"
        if (os.contains("mac") || os.contains("darwin"))
            return MAC;
        if (os.contains("win"))
            return WINDOWS;
        return LINUX;
    }

    /**
     * Extension (with leading dot) of files the OS runs directly. Empty on
     * POSIX systems, where executables carry no extension.
     */
    public String nativeExecutableExtension() {
        return this == WINDOWS ? ".exe" : "";
    }

    /**
     * Locates the {@code java} launcher of the running JVM, falling back to
     * {@code JAVA_HOME} and finally to whatever {@code java} is on the PATH.
     */
    public String javaExecutable() {
        String binary = this == WINDOWS ? "java.exe" : "java";

        String javaHome = System.getProperty("java.home");
        if (javaHome != null) {
            Path java = Path.of(javaHome, "bin", binary);
            if (Files.isExecutable(java))
                return java.toString();
        }

        String envHome = System.getenv("JAVA_HOME");
        if (envHome != null) {
            Path java = Path.of(envHome, "bin", binary);
            if (Files.isExecutable(java))
                return java.toString();
        }
        return "java";
    }
}
