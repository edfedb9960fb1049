package com.blueprintprobe.extract;

import com.blueprintprobe.source.SourceDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parse phase for a single document: strips comments, extracts statement blocks, attaches
 * adjacent proofs and collects back-referencing proofs.
 *
 * Holds no mutable state, so one instance can parse many documents concurrently.
 */
public class DocumentParser {

    private final EnvironmentExtractor statementExtractor;
    private final ProofAssociator proofAssociator = new ProofAssociator();

    public DocumentParser(List<String> environmentTypes) {
        this.statementExtractor = new EnvironmentExtractor(environmentTypes);
    }

    public ParsedDocument parse(SourceDocument document) {
        String text = CommentStripper.strip(document.text());
        String path = document.relativePath();
        LineIndex lines = new LineIndex(text);
        List<String> warnings = new ArrayList<>();

        List<ParsedStatement> statements = new ArrayList<>();
        for (EnvironmentBlock block : statementExtractor.extract(text, path, lines, warnings)) {
            Annotations annotations = AnnotationMacros.read(block.content());
            List<String> labels = new ArrayList<>(annotations.labels());

            Optional<ProofBlock> proof = proofAssociator.followingProof(text, block.end(), lines);
            proof.ifPresent(p -> labels.addAll(p.annotations().labels()));

            statements.add(new ParsedStatement(block, labels, annotations, proof.orElse(null)));
        }

        List<StandaloneProof> standalone = proofAssociator.standaloneProofs(text, path, lines, warnings);
        return new ParsedDocument(path, statements, standalone, warnings);
    }
}
