package de.bsommerfeld.onova.resolve;

import de.bsommerfeld.onova.download.Downloader;
import de.bsommerfeld.onova.progress.ProgressListener;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

/**
 * Package download shared by the HTTP resolvers: byte progress becomes a
 * fraction, and completion always reports {@code 1.0}, also for chunked
 * responses that announce no length.
 */
final class PackageDownloads {

    private PackageDownloads() {
    }

    static void download(URI url, Path destination, ProgressListener progress)
            throws IOException, InterruptedException {
        Downloader.toFile(url, destination, (read, total) -> {
            if (total > 0) {
                progress.report((double) read / total);
            }
        });
        progress.report(1.0);
    }
}
