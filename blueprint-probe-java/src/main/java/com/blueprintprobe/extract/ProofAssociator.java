package com.blueprintprobe.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pairs statements with their proofs.
 *
 * A proof belongs to the statement it follows when only whitespace lies between them and it
 * carries no {@code \proves}. Proofs carrying {@code \proves} are collected separately by
 * {@link #standaloneProofs} no matter where they sit.
 */
public class ProofAssociator {

    static final String PROOF = "proof";

    private final EnvironmentExtractor proofExtractor = new EnvironmentExtractor(List.of(PROOF));

    /**
     * Returns the proof that starts right after {@code statementEnd}, allowing only whitespace
     * in between, unless that proof carries a back-reference.
     */
    public Optional<ProofBlock> followingProof(String text, int statementEnd, LineIndex lines) {
        int pos = statementEnd;
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;

        EnvironmentScanner.Opener opener = EnvironmentScanner.openerAt(text, pos);
        if (opener == null || !opener.name().equals(PROOF)) return Optional.empty();

        int endMarker = EnvironmentScanner.matchingEnd(text, PROOF, opener.contentStart());
        if (endMarker < 0) return Optional.empty();

        Annotations annotations = AnnotationMacros.read(text.substring(opener.contentStart(), endMarker));
        if (annotations.hasBackReference()) return Optional.empty();

        int end = endMarker + EnvironmentScanner.endMarkerLength(PROOF);
        return Optional.of(new ProofBlock(lines.range(opener.start(), end), annotations));
    }

    /** Every proof in the document that carries a {@code \proves} back-reference. */
    public List<StandaloneProof> standaloneProofs(String text, String relativePath, LineIndex lines,
                                                  List<String> warnings) {
        List<StandaloneProof> proofs = new ArrayList<>();
        for (EnvironmentBlock block : proofExtractor.extract(text, relativePath, lines, warnings)) {
            Annotations annotations = AnnotationMacros.read(block.content());
            if (annotations.hasBackReference()) {
                proofs.add(new StandaloneProof(relativePath, new ProofBlock(block.lines(), annotations)));
            }
        }
        return proofs;
    }
}
