package de.bsommerfeld.onova.model;

import java.util.Comparator;
import java.util.Optional;

/**
 * Structured application version of two to four numeric components
 * ({@code major.minor[.build[.revision]]}).
 *
 * <p>
 * Undefined trailing components are stored as {@code -1}. They order
 * before {@code 0}, so {@code 1.2} sorts below {@code 1.2.0}, and they are
 * omitted from {@link #toString()}. The string form doubles as the name of
 * the staged content directory, which is why parsing and printing must
 * round-trip exactly.
 *
 * @param major    first component, never negative
 * @param minor    second component, never negative
 * @param build    third component, or {@code -1} if undefined
 * @param revision fourth component, or {@code -1} if undefined
 */
public record Version(int major, int minor, int build, int revision) implements Comparable<Version> {

    private static final Comparator<Version> ORDER = Comparator.comparingInt(Version::major)
            .thenComparingInt(Version::minor)
            .thenComparingInt(Version::build)
            .thenComparingInt(Version::revision);

    public Version {
        if (major < 0 || minor < 0) {
            throw new IllegalArgumentException("Major and minor must not be negative");
        }
        if (build < -1 || revision < -1) {
            throw new IllegalArgumentException("Build and revision must be -1 (undefined) or positive");
        }
        if (build == -1 && revision != -1) {
            throw new IllegalArgumentException("Revision requires a build component");
        }
    }

    public Version(int major, int minor) {
        this(major, minor, -1, -1);
    }

    public Version(int major, int minor, int build) {
        this(major, minor, build, -1);
    }

    /**
     * Parses a dotted version string.
     *
     * @throws IllegalArgumentException if the input is not two to four
     *                                  non-negative integers separated by dots
     */
    public static Version parse(String text) {
        return tryParse(text)
                .orElseThrow(() -> new IllegalArgumentException("Not a version: " + text));
    }

    /** Lenient counterpart of {@link #parse(String)} for directory and file names. */
    public static Optional<Version> tryParse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        String[] parts = text.strip().split("\\.", -1);
        if (parts.length < 2 || parts.length > 4) {
            return Optional.empty();
        }

        int[] components = { -1, -1, -1, -1 };
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].isEmpty() || !parts[i].chars().allMatch(Character::isDigit)) {
                return Optional.empty();
            }
            try {
                components[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.of(new Version(components[0], components[1], components[2], components[3]));
    }

    @Override
    public int compareTo(Version other) {
        return ORDER.compare(this, other);
    }

    /** Returns {@code true} if this version sorts strictly after {@code other}. */
    public boolean isNewerThan(Version other) {
        return compareTo(other) > 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(major).append('.').append(minor);
        if (build >= 0) {
            sb.append('.').append(build);
            if (revision >= 0) {
                sb.append('.').append(revision);
            }
        }
        return sb.toString();
    }
}
