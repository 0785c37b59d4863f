package de.bsommerfeld.onova.extract;

import de.bsommerfeld.onova.progress.ProgressListener;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Extracts zip packages.
 *
 * <p>
 * Entries are written relative to the destination; backslashes in entry
 * names are normalized to forward slashes. An entry that would resolve
 * outside the destination aborts the extraction. Progress is reported per
 * entry.
 */
public final class ZipPackageExtractor implements PackageExtractor {

    @Override
    public void extractPackage(Path sourceFile, Path destinationDir, ProgressListener progress)
            throws IOException, InterruptedException {
        Path root = destinationDir.toAbsolutePath().normalize();

        try (ZipFile zip = new ZipFile(sourceFile.toFile())) {
            int total = zip.size();
            int done = 0;

            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("Extraction of " + sourceFile + " cancelled");
                }

                ZipEntry entry = entries.nextElement();
                String name = entry.getName().replace('\\', '/');
                Path target = root.resolve(name).normalize();
                if (!target.startsWith(root)) {
                    throw new IOException("Zip entry escapes destination directory: " + entry.getName());
                }

                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    try (InputStream in = zip.getInputStream(entry)) {
                        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                    }
                }

                done++;
                progress.report((double) done / total);
            }
        }
    }
}
