package com.blueprintprobe.extract;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds all blocks of the configured environment types in one comment-stripped document,
 * in order of their position.
 *
 * Outermost wins: once a configured block is captured, scanning resumes after its matching
 * {@code \end}, so configured blocks nested inside it are reported as warnings and not extracted.
 * A configured opener that is never closed is reported and skipped.
 */
public class EnvironmentExtractor {

    private final Set<String> types;

    public EnvironmentExtractor(List<String> types) {
        this.types = new LinkedHashSet<>(types);
    }

    public List<EnvironmentBlock> extract(String text, String relativePath, LineIndex lines, List<String> warnings) {
        List<EnvironmentBlock> blocks = new ArrayList<>();
        int pos = 0;
        while (pos < text.length()) {
            EnvironmentScanner.Opener opener = EnvironmentScanner.nextOpener(text, pos);
            if (opener == null) break;
            if (!types.contains(opener.name())) {
                pos = opener.contentStart();
                continue;
            }
            int endMarker = EnvironmentScanner.matchingEnd(text, opener.name(), opener.contentStart());
            if (endMarker < 0) {
                warnings.add("unterminated \\begin{" + opener.name() + "} in " + relativePath
                        + " at line " + lines.lineOf(opener.start()) + " (ignored)");
                pos = opener.contentStart();
                continue;
            }
            int end = endMarker + EnvironmentScanner.endMarkerLength(opener.name());
            String content = text.substring(opener.contentStart(), endMarker);
            blocks.add(new EnvironmentBlock(
                    opener.name(), relativePath, opener.start(), end, content, lines.range(opener.start(), end)));
            reportNested(text, opener, endMarker, relativePath, lines, warnings);
            pos = end;
        }
        return blocks;
    }

    private void reportNested(String text, EnvironmentScanner.Opener outer, int endMarker,
                              String relativePath, LineIndex lines, List<String> warnings) {
        int pos = outer.contentStart();
        while (pos < endMarker) {
            EnvironmentScanner.Opener inner = EnvironmentScanner.nextOpener(text, pos);
            if (inner == null || inner.start() >= endMarker) return;
            if (types.contains(inner.name())) {
                warnings.add("\\begin{" + inner.name() + "} nested inside \\begin{" + outer.name() + "} in "
                        + relativePath + " at line " + lines.lineOf(inner.start())
                        + " is part of the outer block and not extracted separately");
            }
            pos = inner.contentStart();
        }
    }
}
