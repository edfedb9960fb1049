package com.blueprintprobe.source;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of source resolution: the blueprint source directory and the files found under it.
 */
public record BlueprintSources(
    Path sourceDir,              // absolute path to <project>/blueprint/src
    Path webTex,                 // nullable
    List<Path> contentFiles,     // every .tex file except web.tex and print.tex, sorted
    List<Path> allTexFiles       // every .tex file, sorted
) {}
