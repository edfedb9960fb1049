package com.blueprintprobe.graph;

import com.blueprintprobe.extract.Annotations;
import com.blueprintprobe.extract.ParsedDocument;
import com.blueprintprobe.extract.ParsedStatement;
import com.blueprintprobe.extract.ProofBlock;
import com.blueprintprobe.extract.StandaloneProof;
import com.blueprintprobe.graph.StubModel.Stub;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the parse results of all documents into the final stub graph.
 *
 * Runs three sequential stages over one {@link GraphContext}:
 * <ol>
 *   <li>register: reserve labels, synthesize missing ones, build one stub per statement;</li>
 *   <li>merge: fold back-referencing proofs into the stubs they prove;</li>
 *   <li>resolve: rewrite every dependency from label to canonical stub name.</li>
 * </ol>
 * Resolution comes last, so a statement may use a label declared later in traversal order.
 */
public class GraphAssembler {

    /**
     * @param documents parse results in traversal order
     * @return canonical stub name -> stub
     * @throws LabelRegistry.DuplicateLabelException if a label is declared twice
     * @throws LabelRegistry.UnknownLabelException   if a dependency names no known label
     */
    public Map<String, Stub> assemble(List<ParsedDocument> documents) {
        GraphContext context = new GraphContext();
        register(context, documents);
        mergeStandaloneProofs(context, documents);
        resolveReferences(context);
        return context.freeze();
    }

    void register(GraphContext context, List<ParsedDocument> documents) {
        LabelRegistry registry = context.registry();
        for (ParsedDocument document : documents) {
            for (ParsedStatement statement : document.statements()) {
                List<String> labels = new ArrayList<>(statement.labels());
                for (String label : labels) {
                    registry.reserve(label, statement.relativePath());
                }
                if (labels.isEmpty()) {
                    labels.add(registry.synthesize());
                }

                String name = stubName(statement.relativePath(), labels);
                context.putStub(name, newStub(statement, labels));
                for (String label : labels) {
                    registry.recordOwner(label, name);
                }
            }
        }
    }

    void mergeStandaloneProofs(GraphContext context, List<ParsedDocument> documents) {
        LabelRegistry registry = context.registry();
        for (ParsedDocument document : documents) {
            for (StandaloneProof proof : document.standaloneProofs()) {
                // Two labels of the same statement must not merge the proof twice.
                Set<String> owners = new LinkedHashSet<>();
                for (String target : proof.targets()) {
                    Optional<String> owner = registry.lookup(target);
                    if (owner.isEmpty()) {
                        System.err.println("[blueprint-probe] WARNING: \\proves target not found (proof skipped for it): "
                                + target + " in " + proof.relativePath() + " at line " + proof.lines().start());
                        continue;
                    }
                    owners.add(owner.get());
                }
                for (String owner : owners) {
                    Stub stub = context.stub(owner);
                    if (stub.stubProof != null) {
                        System.err.println("[blueprint-probe] WARNING: " + owner + " has more than one proof; keeping the first span"
                                + " and accumulating the proof in " + proof.relativePath() + " at line " + proof.lines().start());
                    }
                    applyProof(stub, proof.proof());
                }
            }
        }
    }

    void resolveReferences(GraphContext context) {
        LabelRegistry registry = context.registry();
        for (Map.Entry<String, Stub> entry : context.entries()) {
            String name = entry.getKey();
            Stub stub = entry.getValue();
            stub.specDependencies = resolveAll(registry, stub.specDependencies, name, stub.stubPath);
            if (stub.proofDependencies != null) {
                // Proofs may cite one stub through two of its labels.
                stub.proofDependencies = new ArrayList<>(new LinkedHashSet<>(
                        resolveAll(registry, stub.proofDependencies, name, stub.stubPath)));
            }
        }
    }

    /** Canonical name: document path and the last label of the statement. */
    static String stubName(String relativePath, List<String> labels) {
        return relativePath + "/" + labels.get(labels.size() - 1);
    }

    static Stub newStub(ParsedStatement statement, List<String> labels) {
        Annotations spec = statement.annotations();
        Stub stub = new Stub();
        stub.stubType = statement.block().type();
        stub.stubPath = statement.relativePath();
        stub.stubSpec = statement.block().lines();
        stub.labels = List.copyOf(labels);
        stub.codeName = spec.primaryCodeName();
        stub.codeNames = spec.codeNames().size() > 1 ? spec.codeNames() : null;
        stub.specOk = spec.leanOk();
        stub.mathlibOk = spec.mathlibOk();
        stub.notReady = spec.notReady();
        stub.discussion = spec.discussions().isEmpty() ? null : spec.discussions();
        stub.specDependencies = spec.uses();
        if (statement.proof() != null) {
            applyProof(stub, statement.proof());
        }
        return stub;
    }

    /**
     * Folds a proof into the proof side of {@code stub}. The first proof sets the span; later
     * proofs append unseen dependency labels, tags and code-names;
     * dependencies are deduplicated again once resolved to stub names. Flags only ever turn on.
     */
    static void applyProof(Stub stub, ProofBlock proof) {
        Annotations p = proof.annotations();
        if (stub.stubProof == null) {
            stub.stubProof = proof.lines();
        }
        if (p.leanOk())    stub.proofOk = Boolean.TRUE;
        if (p.mathlibOk()) stub.proofMathlibOk = Boolean.TRUE;
        if (p.notReady())  stub.proofNotReady = Boolean.TRUE;

        stub.proofDependencies = accumulate(stub.proofDependencies, p.uses());
        stub.proofDiscussion = accumulate(stub.proofDiscussion, p.discussions());

        List<String> current = stub.proofCodeNames != null ? stub.proofCodeNames
                : stub.proofCodeName != null ? List.of(stub.proofCodeName) : null;
        List<String> codeNames = accumulate(current, p.codeNames());
        stub.proofCodeName = codeNames == null ? null : codeNames.get(0);
        stub.proofCodeNames = codeNames != null && codeNames.size() > 1 ? codeNames : null;
    }

    /** Appends the entries of {@code incoming} not yet present; null stands for "none". */
    private static List<String> accumulate(List<String> existing, List<String> incoming) {
        if (existing == null) {
            return incoming.isEmpty() ? null : new ArrayList<>(incoming);
        }
        List<String> merged = new ArrayList<>(existing);
        for (String entry : incoming) {
            if (!merged.contains(entry)) merged.add(entry);
        }
        return merged;
    }

    private static List<String> resolveAll(LabelRegistry registry, List<String> labels, String stubName, String path) {
        List<String> resolved = new ArrayList<>(labels.size());
        for (String label : labels) {
            resolved.add(registry.resolve(label, stubName, path));
        }
        return resolved;
    }
}
