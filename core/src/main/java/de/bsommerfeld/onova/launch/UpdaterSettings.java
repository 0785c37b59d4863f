package de.bsommerfeld.onova.launch;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

/**
 * Tuning for the updater process. Passed as {@code -D} system properties
 * ahead of {@code -jar} so the positional contract stays untouched.
 *
 * @param pollInterval       pause between write-access probes
 * @param timeout            how long to wait for the application to release
 *                           its files; {@link Duration#ZERO} waits forever
 * @param executableFallback whether a native sibling executable may be
 *                           restarted in place of the updatee file
 */
public record UpdaterSettings(Duration pollInterval, Duration timeout, boolean executableFallback) {

    public static final String POLL_INTERVAL_KEY = "onova.updater.poll-interval-ms";
    public static final String TIMEOUT_KEY = "onova.updater.timeout-ms";
    public static final String EXECUTABLE_FALLBACK_KEY = "onova.updater.executable-fallback";

    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    public static final UpdaterSettings DEFAULT =
            new UpdaterSettings(DEFAULT_POLL_INTERVAL, Duration.ZERO, true);

    public UpdaterSettings {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            pollInterval = DEFAULT_POLL_INTERVAL;
        }
        if (timeout == null || timeout.isNegative()) {
            timeout = Duration.ZERO;
        }
    }

    public boolean isBounded() {
        return !timeout.isZero();
    }

    public List<String> toSystemPropertyArguments() {
        return List.of(
                "-D" + POLL_INTERVAL_KEY + "=" + pollInterval.toMillis(),
                "-D" + TIMEOUT_KEY + "=" + timeout.toMillis(),
                "-D" + EXECUTABLE_FALLBACK_KEY + "=" + executableFallback);
    }

    /** Reads settings, using defaults for missing or malformed values. */
    public static UpdaterSettings fromSystemProperties(Properties properties) {
        return new UpdaterSettings(
                Duration.ofMillis(readLong(properties, POLL_INTERVAL_KEY, DEFAULT.pollInterval().toMillis())),
                Duration.ofMillis(readLong(properties, TIMEOUT_KEY, DEFAULT.timeout().toMillis())),
                Boolean.parseBoolean(properties.getProperty(EXECUTABLE_FALLBACK_KEY,
                        Boolean.toString(DEFAULT.executableFallback()))));
    }

    private static long readLong(Properties properties, String key, long fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
