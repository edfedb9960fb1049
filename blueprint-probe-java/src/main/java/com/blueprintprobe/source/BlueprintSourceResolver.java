package com.blueprintprobe.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates the blueprint sources of a project: {@code <project>/blueprint/src} and the .tex files in it.
 */
public class BlueprintSourceResolver {

    static final String TEX_EXTENSION = ".tex";
    static final String WEB_TEX = "web.tex";
    static final String PRINT_TEX = "print.tex";
    private static final Set<String> RESERVED = Set.of(WEB_TEX, PRINT_TEX);

    public static class MissingSourceDirectoryException extends RuntimeException {
        public MissingSourceDirectoryException(String message) { super(message); }
    }

    public static class SourceScanException extends RuntimeException {
        public SourceScanException(String message, Throwable cause) { super(message, cause); }
    }

    /**
     * @param projectRoot the project directory containing {@code blueprint/src}
     * @throws MissingSourceDirectoryException if {@code blueprint/src} does not exist
     */
    public BlueprintSources resolve(Path projectRoot) {
        Path sourceDir = projectRoot.resolve("blueprint").resolve("src").toAbsolutePath().normalize();
        if (!Files.isDirectory(sourceDir)) {
            throw new MissingSourceDirectoryException("blueprint/src directory not found at " + sourceDir);
        }

        List<Path> texFiles;
        try (Stream<Path> walk = Files.walk(sourceDir)) {
            texFiles = walk
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(TEX_EXTENSION))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SourceScanException("Could not scan " + sourceDir + ": " + e.getMessage(), e);
        }

        List<Path> contentFiles = texFiles.stream()
            .filter(p -> !RESERVED.contains(p.getFileName().toString()))
            .collect(Collectors.toList());

        Path webTex = sourceDir.resolve(WEB_TEX);
        return new BlueprintSources(sourceDir, Files.isRegularFile(webTex) ? webTex : null, contentFiles, texFiles);
    }
}
