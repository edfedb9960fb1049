package com.blueprintprobe.graph;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Project-wide label namespace: which labels are taken, and which stub owns each one.
 *
 * Synthesized labels are {@code a} followed by a 10-digit zero-padded counter. The counter is
 * shared by the whole run and skips any value already reserved.
 */
public class LabelRegistry {

    static final String SYNTHETIC_ORIGIN = "<synthesized>";

    // label -> document that declared it
    private final Map<String, String> reserved = new HashMap<>();
    // label -> canonical stub name
    private final Map<String, String> owners = new HashMap<>();
    private long counter = 0;

    public static class DuplicateLabelException extends RuntimeException {
        private final String label;

        public DuplicateLabelException(String label, String path, String firstPath) {
            super("Duplicate label found: " + label + " in " + path + " (already declared in " + firstPath + ")");
            this.label = label;
        }

        public String getLabel() { return label; }
    }

    public static class UnknownLabelException extends RuntimeException {
        private final String label;

        public UnknownLabelException(String label, String stubName, String path) {
            super("Unknown label: " + label + " referenced by " + stubName + " in " + path);
            this.label = label;
        }

        public String getLabel() { return label; }
    }

    /**
     * Claims {@code label} for a block of {@code path}.
     *
     * @throws DuplicateLabelException if the label was reserved before
     */
    public void reserve(String label, String path) {
        String first = reserved.putIfAbsent(label, path);
        if (first != null) {
            throw new DuplicateLabelException(label, path, first);
        }
    }

    /** Reserves and returns the next free synthetic label. */
    public String synthesize() {
        while (true) {
            String candidate = syntheticLabel(counter++);
            if (!reserved.containsKey(candidate)) {
                reserved.put(candidate, SYNTHETIC_ORIGIN);
                return candidate;
            }
        }
    }

    public void recordOwner(String label, String stubName) {
        owners.put(label, stubName);
    }

    /**
     * Canonical stub name owning {@code label}, referenced by {@code stubName} in {@code path}.
     *
     * @throws UnknownLabelException if no stub owns {@code label}
     */
    public String resolve(String label, String stubName, String path) {
        String owner = owners.get(label);
        if (owner == null) throw new UnknownLabelException(label, stubName, path);
        return owner;
    }

    public Optional<String> lookup(String label) {
        return Optional.ofNullable(owners.get(label));
    }

    static String syntheticLabel(long n) {
        return String.format("a%010d", n);
    }
}
