package de.bsommerfeld.onova.resolve;

import java.net.URI;

/**
 * Identifies a GitHub repository for release queries.
 *
 * @param owner repository owner, a GitHub user or organization name
 * @param repo  repository name
 */
public record GitHubRepository(String owner, String repo) {

    /**
     * Parses {@code "owner/repo"} slug notation into a typed record.
     *
     * @throws IllegalArgumentException if the input doesn't contain exactly one
     *                                  slash or either segment is blank
     */
    public static GitHubRepository of(String slug) {
        String[] parts = slug.split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Expected 'owner/repo', got: " + slug);
        }
        return new GitHubRepository(parts[0], parts[1]);
    }

    /** REST endpoint listing the newest releases, published and pre-release. */
    public URI releasesUrl() {
        return URI.create("https://api.github.com/repos/" + owner + "/" + repo + "/releases?per_page=100");
    }
}
