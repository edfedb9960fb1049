package com.blueprintprobe.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads documents into memory, keyed by their path relative to the source directory.
 */
public class DocumentReader {

    public static class DocumentReadException extends RuntimeException {
        public DocumentReadException(String message, Throwable cause) { super(message, cause); }
    }

    public SourceDocument read(Path sourceDir, Path file) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            return new SourceDocument(relativize(sourceDir, file), text);
        } catch (IOException e) {
            throw new DocumentReadException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    static String relativize(Path sourceDir, Path file) {
        Path relative = sourceDir.relativize(file.toAbsolutePath().normalize());
        return relative.toString().replace('\\', '/');
    }
}
