package com.coderenew.core.scan;

import com.coderenew.core.exception.ScanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Extracts an uploaded plugin or theme archive into a working directory.
 *
 * <p>Entries whose normalized target lies outside the working directory are
 * rejected and abort the extraction.
 */
public class ArchiveExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArchiveExtractor.class);

    /**
     * Extracts every entry of a zip archive.
     *
     * @param archive zip file
     * @param targetDirectory directory to extract into, created if missing
     * @return number of files extracted
     * @throws ScanException if the archive is unreadable or contains an escaping entry
     */
    public int extract(Path archive, Path targetDirectory) {
        if (!Files.isRegularFile(archive)) {
            throw new ScanException("Archive not found: " + archive);
        }

        Path root = targetDirectory.toAbsolutePath().normalize();
        int extracted = 0;
        try {
            Files.createDirectories(root);
            try (InputStream in = Files.newInputStream(archive);
                 ZipInputStream zip = new ZipInputStream(in)) {
                ZipEntry entry;
                while ((entry = zip.getNextEntry()) != null) {
                    Path target = root.resolve(entry.getName()).normalize();
                    if (!target.startsWith(root)) {
                        throw new ScanException("Archive entry escapes target directory: " + entry.getName());
                    }
                    if (entry.isDirectory()) {
                        Files.createDirectories(target);
                    } else {
                        Path parent = target.getParent();
                        if (parent != null) {
                            Files.createDirectories(parent);
                        }
                        Files.copy(zip, target, StandardCopyOption.REPLACE_EXISTING);
                        extracted++;
                    }
                    zip.closeEntry();
                }
            }
        } catch (IOException e) {
            throw new ScanException("Failed to extract archive " + archive + ": " + e.getMessage(), e);
        }

        if (extracted == 0) {
            log.warn("Archive {} contained no files", archive);
        }
        log.info("Extracted {} files from {} into {}", extracted, archive, root);
        return extracted;
    }
}
