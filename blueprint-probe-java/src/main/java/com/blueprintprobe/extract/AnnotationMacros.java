package com.blueprintprobe.extract;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless readers for the blueprint annotation macros found inside block bodies.
 * Every reader tolerates absence and returns an empty list or {@code false}.
 */
public final class AnnotationMacros {

    public static final String LABEL = "label";
    public static final String LEAN = "lean";
    public static final String USES = "uses";
    public static final String PROVES = "proves";
    public static final String DISCUSSION = "discussion";
    public static final String LEAN_OK = "leanok";
    public static final String MATHLIB_OK = "mathlibok";
    public static final String NOT_READY = "notready";

    private AnnotationMacros() {}

    /** Reads every macro from {@code content}; labels are taken from top-level text only. */
    public static Annotations read(String content) {
        return new Annotations(
            labels(content),
            codeNames(content),
            hasFlag(content, LEAN_OK),
            hasFlag(content, MATHLIB_OK),
            hasFlag(content, NOT_READY),
            discussions(content),
            uses(content),
            proves(content)
        );
    }

    /** Top-level {@code \label} arguments in order; labels inside nested environments are ignored. */
    public static List<String> labels(String content) {
        List<String> labels = new ArrayList<>();
        for (String arg : arguments(NestedEnvironmentMasker.mask(content), LABEL)) {
            String label = arg.trim();
            if (!label.isEmpty()) labels.add(label);
        }
        return labels;
    }

    public static List<String> codeNames(String content) {
        return commaList(content, LEAN);
    }

    public static List<String> uses(String content) {
        return commaList(content, USES);
    }

    public static List<String> proves(String content) {
        return commaList(content, PROVES);
    }

    public static List<String> discussions(String content) {
        return arguments(content, DISCUSSION);
    }

    /** True iff the bare token {@code \name} occurs and is not the prefix of a longer macro name. */
    public static boolean hasFlag(String content, String name) {
        int i = 0;
        int n = content.length();
        while (i < n) {
            if (content.charAt(i) != '\\') {
                i++;
                continue;
            }
            if (i + 1 < n && content.charAt(i + 1) == '\\') {
                i += 2;
                continue;
            }
            int after = i + 1 + name.length();
            if (content.startsWith(name, i + 1) && (after >= n || !Character.isLetter(content.charAt(after)))) {
                return true;
            }
            i++;
        }
        return false;
    }

    /** Every occurrence of {@code \name{a, b, ...}} flattened in order; entries trimmed, blanks dropped. */
    static List<String> commaList(String content, String name) {
        List<String> entries = new ArrayList<>();
        for (String arg : arguments(content, name)) {
            for (String part : arg.split(",")) {
                String entry = part.trim();
                if (!entry.isEmpty()) entries.add(entry);
            }
        }
        return entries;
    }

    /**
     * Raw brace arguments of every {@code \name{...}} occurrence. Whitespace is allowed between the
     * macro name and its brace; nested braces inside the argument are kept balanced.
     * An argument whose closing brace is missing is skipped.
     */
    public static List<String> arguments(String content, String name) {
        List<String> args = new ArrayList<>();
        int i = 0;
        int n = content.length();
        while (i < n) {
            if (content.charAt(i) != '\\') {
                i++;
                continue;
            }
            if (i + 1 < n && content.charAt(i + 1) == '\\') {
                i += 2;
                continue;
            }
            if (!content.startsWith(name, i + 1)) {
                i++;
                continue;
            }
            int brace = i + 1 + name.length();
            while (brace < n && (content.charAt(brace) == ' ' || content.charAt(brace) == '\t')) brace++;
            if (brace >= n || content.charAt(brace) != '{') {
                i++;
                continue;
            }
            int close = closingBrace(content, brace);
            if (close < 0) {
                i = brace + 1;
                continue;
            }
            args.add(content.substring(brace + 1, close));
            i = close + 1;
        }
        return args;
    }

    private static int closingBrace(String content, int open) {
        int depth = 0;
        for (int i = open; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }
}
