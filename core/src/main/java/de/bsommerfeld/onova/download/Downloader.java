package de.bsommerfeld.onova.download;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * HTTP download utility built on {@link HttpClient}.
 *
 * <p>
 * Supports streaming to a file (with atomic rename) and in-memory string
 * download for small metadata documents. File downloads report progress via
 * {@link DownloadProgressListener}.
 *
 * <h3>Redirect handling</h3>
 * The shared {@link HttpClient} follows redirects automatically. GitHub
 * release asset URLs redirect from the API domain to the CDN.
 *
 * <h3>Cancellation</h3>
 * Interrupting the downloading thread aborts the transfer between chunks;
 * the temporary file is removed and {@link InterruptedException} propagates.
 */
public final class Downloader {

    private static final Logger LOG = LoggerFactory.getLogger(Downloader.class);

    private static final HttpClient HTTP = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    private Downloader() {
    }

    /**
     * Downloads a URL to the given target file.
     *
     * <p>
     * The download streams into a {@code .tmp} sibling first, then is
     * renamed to the target path. A failed or cancelled download leaves no
     * file at {@code target}.
     */
    public static void toFile(URI url, Path target, DownloadProgressListener listener)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(url).GET().build();
        HttpResponse<InputStream> response = HTTP.send(request, HttpResponse.BodyHandlers.ofInputStream());

        try (InputStream in = response.body()) {
            validateStatus(response.statusCode(), url);

            long totalBytes = response.headers()
                    .firstValueAsLong("Content-Length")
                    .orElse(-1);

            Files.createDirectories(target.toAbsolutePath().getParent());
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            try {
                transferWithProgress(in, temp, totalBytes, listener);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
        }
        LOG.debug("Downloaded {} to {}", url, target);
    }

    /**
     * Downloads a URL as a UTF-8 string. Progress is not reported since this
     * is used for small payloads (manifests, release metadata).
     */
    public static String toString(URI url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(url)
                .header("Accept", "application/json, text/plain, */*")
                .GET()
                .build();
        HttpResponse<InputStream> response = HTTP.send(request, HttpResponse.BodyHandlers.ofInputStream());

        try (InputStream in = response.body()) {
            validateStatus(response.statusCode(), url);
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }

    /**
     * Streams bytes from the input to the target file while reporting
     * progress. Uses an 8 KB buffer: large enough for throughput, small enough
     * for responsive progress updates.
     */
    static void transferWithProgress(InputStream in, Path target, long totalBytes,
            DownloadProgressListener listener) throws IOException, InterruptedException {
        try (var out = Files.newOutputStream(target)) {
            byte[] buffer = new byte[8192];
            long transferred = 0;
            int read;
            while ((read = in.read(buffer)) != -1) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("Download cancelled");
                }
                out.write(buffer, 0, read);
                transferred += read;
                listener.onProgress(transferred, totalBytes);
            }
        } catch (InterruptedIOException e) {
            InterruptedException interrupted = new InterruptedException("Download cancelled");
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    /** Validates that the HTTP status code is in the 2xx success range. */
    static void validateStatus(int status, URI url) throws IOException {
        if (status < 200 || status >= 300) {
            throw new IOException("HTTP " + status + " for " + url);
        }
    }
}
