package com.blueprintprobe.extract;

import com.blueprintprobe.graph.StubModel.LineRange;

/**
 * One {@code \begin{type}...\end{type}} occurrence in a comment-stripped document.
 *
 * @param type         environment name
 * @param relativePath document path relative to the blueprint source directory
 * @param start        offset of the {@code \begin} marker
 * @param end          offset just past the {@code \end} marker
 * @param content      text between the markers
 * @param lines        1-indexed line span of {@code [start, end)}
 */
public record EnvironmentBlock(
    String type,
    String relativePath,
    int start,
    int end,
    String content,
    LineRange lines
) {}
