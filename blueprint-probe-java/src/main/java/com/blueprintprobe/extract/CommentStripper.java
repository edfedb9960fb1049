package com.blueprintprobe.extract;

/**
 * Removes LaTeX line comments while keeping the line structure intact.
 *
 * A {@code %} starts a comment that runs to the end of the line; the newline itself is kept.
 * A backslash escapes the following character, so {@code \%} is copied through as text.
 */
public final class CommentStripper {

    private CommentStripper() {}

    public static String strip(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\\') {
                out.append(c);
                if (i + 1 < n) {
                    out.append(text.charAt(i + 1));
                }
                i += 2;
            } else if (c == '%') {
                while (i < n && text.charAt(i) != '\n') i++;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
