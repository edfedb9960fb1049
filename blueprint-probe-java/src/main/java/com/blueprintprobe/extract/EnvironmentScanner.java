package com.blueprintprobe.extract;

/**
 * Low-level scanning over {@code \begin{name}} / {@code \end{name}} markers.
 *
 * A double backslash is a line break, never the start of a marker, so it is stepped over as a unit.
 */
final class EnvironmentScanner {

    private static final String BEGIN = "\\begin{";

    private EnvironmentScanner() {}

    /** An opening marker: {@code \begin{name}} spanning {@code [start, contentStart)}. */
    record Opener(String name, int start, int contentStart) {}

    /** Finds the next opening marker at or after {@code from}, or null if there is none. */
    static Opener nextOpener(String text, int from) {
        int i = from;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c != '\\') {
                i++;
                continue;
            }
            Opener opener = openerAt(text, i);
            if (opener != null) return opener;
            i += (i + 1 < n && text.charAt(i + 1) == '\\') ? 2 : 1;
        }
        return null;
    }

    /** Reads an opening marker starting exactly at {@code pos}, or null if none starts there. */
    static Opener openerAt(String text, int pos) {
        if (!text.startsWith(BEGIN, pos)) return null;
        int nameStart = pos + BEGIN.length();
        int close = nameStart;
        while (close < text.length()) {
            char c = text.charAt(close);
            if (c == '}') break;
            if (c == '{' || c == '\n' || c == '\\') return null;
            close++;
        }
        if (close >= text.length() || close == nameStart) return null;
        return new Opener(text.substring(nameStart, close), pos, close + 1);
    }

    /**
     * Returns the offset of the {@code \end{name}} that closes an environment whose content
     * starts at {@code from}, counting further {@code \begin{name}} markers of the same name
     * as nesting. Returns -1 if the environment is never closed.
     */
    static int matchingEnd(String text, String name, int from) {
        String begin = BEGIN + name + "}";
        String end = "\\end{" + name + "}";
        int depth = 1;
        int i = from;
        int n = text.length();
        while (i < n) {
            if (text.charAt(i) != '\\') {
                i++;
            } else if (text.startsWith(begin, i)) {
                depth++;
                i += begin.length();
            } else if (text.startsWith(end, i)) {
                depth--;
                if (depth == 0) return i;
                i += end.length();
            } else {
                i += (i + 1 < n && text.charAt(i + 1) == '\\') ? 2 : 1;
            }
        }
        return -1;
    }

    static int endMarkerLength(String name) {
        return "\\end{".length() + name.length() + 1;
    }
}
