package com.blueprintprobe.source;

/**
 * Raw text of one document and its path relative to the blueprint source directory,
 * always with {@code /} separators.
 */
public record SourceDocument(String relativePath, String text) {}
