package com.blueprintprobe.extract;

/**
 * Deletes every nested {@code \begin{X}...\end{X}} region from a block body so that only
 * top-level declarations remain. Used for label extraction only.
 *
 * An opener without a matching {@code \end} is kept verbatim and scanning resumes right after it.
 */
public final class NestedEnvironmentMasker {

    private NestedEnvironmentMasker() {}

    public static String mask(String content) {
        StringBuilder out = new StringBuilder(content.length());
        int pos = 0;
        while (pos < content.length()) {
            EnvironmentScanner.Opener opener = EnvironmentScanner.nextOpener(content, pos);
            if (opener == null) {
                out.append(content, pos, content.length());
                break;
            }
            out.append(content, pos, opener.start());
            int end = EnvironmentScanner.matchingEnd(content, opener.name(), opener.contentStart());
            if (end < 0) {
                out.append(content, opener.start(), opener.contentStart());
                pos = opener.contentStart();
            } else {
                pos = end + EnvironmentScanner.endMarkerLength(opener.name());
            }
        }
        return out.toString();
    }
}
