package com.blueprintprobe.extract;

import java.util.List;

/**
 * Everything the parse phase learned from one document. Warnings are reported by the caller.
 */
public record ParsedDocument(
    String relativePath,
    List<ParsedStatement> statements,
    List<StandaloneProof> standaloneProofs,
    List<String> warnings
) {

    public ParsedDocument {
        statements = List.copyOf(statements);
        standaloneProofs = List.copyOf(standaloneProofs);
        warnings = List.copyOf(warnings);
    }
}
