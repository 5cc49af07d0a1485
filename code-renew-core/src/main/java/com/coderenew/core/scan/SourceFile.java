package com.coderenew.core.scan;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A source file admitted to a scan.
 *
 * @param path location on disk
 * @param displayPath path reported in issues, relative to the scan root when known
 * @param sizeBytes file size in bytes
 * @param estimatedTokens estimated tokens of the file content
 * @param priority analysis priority, higher first
 */
public record SourceFile(Path path, String displayPath, long sizeBytes, int estimatedTokens, int priority) {

    public SourceFile {
        Objects.requireNonNull(path, "path must not be null");
        if (displayPath == null || displayPath.isBlank()) {
            displayPath = path.toString();
        }
        if (sizeBytes < 0) {
            sizeBytes = 0;
        }
        if (estimatedTokens < 0) {
            estimatedTokens = 0;
        }
    }
}
