package com.blueprintprobe.extract;

import java.util.List;

/**
 * A statement block as read from one document, before any label is registered.
 *
 * @param block       the statement environment
 * @param labels      own top-level labels followed by the adjacent proof's labels
 * @param annotations the statement's own macro payload
 * @param proof       the adjacent proof, or null
 */
public record ParsedStatement(
    EnvironmentBlock block,
    List<String> labels,
    Annotations annotations,
    ProofBlock proof
) {

    public ParsedStatement {
        labels = List.copyOf(labels);
    }

    public String relativePath() {
        return block.relativePath();
    }
}
