package de.bsommerfeld.onova.model;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a version query against a package resolver.
 *
 * @param versions    every version the resolver knows, ascending
 * @param lastVersion the highest known version, or {@code null} if none
 * @param canUpdate   {@code true} iff {@code lastVersion} exists and is
 *                    strictly newer than the installed version
 */
public record CheckForUpdatesResult(List<Version> versions, Version lastVersion, boolean canUpdate) {

    public CheckForUpdatesResult {
        versions = List.copyOf(versions);
    }

    /** Computes the result for the versions a resolver reported. */
    public static CheckForUpdatesResult of(Collection<Version> available, Version installed) {
        List<Version> sorted = available.stream().distinct().sorted().toList();
        Version last = sorted.isEmpty() ? null : sorted.get(sorted.size() - 1);
        boolean canUpdate = last != null && last.isNewerThan(installed);
        return new CheckForUpdatesResult(sorted, last, canUpdate);
    }

    public Optional<Version> lastVersionIfAny() {
        return Optional.ofNullable(lastVersion);
    }
}
