package com.blueprintprobe.report;

import com.blueprintprobe.graph.StubModel.Stub;

import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;

/**
 * Re-keys a stub graph into the per-label and per-code-name reports.
 */
public class ReportBuilder {

    static final String SUCCESS = "success";
    static final String SORRIES = "sorries";

    /** One atom per stub, keyed by label; dependencies are spec- then proof-dependencies. */
    public Map<String, ReportModel.Atom> atoms(Map<String, Stub> stubs) {
        Map<String, ReportModel.Atom> atoms = new TreeMap<>();
        for (Map.Entry<String, Stub> entry : stubs.entrySet()) {
            Stub stub = entry.getValue();
            String label = labelOf(entry.getKey());

            ReportModel.Atom atom = new ReportModel.Atom();
            atom.displayName = label;
            atom.dependencies = new ArrayList<>();
            if (stub.specDependencies != null) atom.dependencies.addAll(stub.specDependencies);
            if (stub.proofDependencies != null) atom.dependencies.addAll(stub.proofDependencies);
            atom.stubPath = stub.stubPath;
            atom.stubText = stub.stubSpec;
            atoms.put(label, atom);
        }
        return atoms;
    }

    /** Whether each labelled statement is formally specified. */
    public Map<String, ReportModel.Spec> specs(Map<String, Stub> stubs) {
        Map<String, ReportModel.Spec> specs = new TreeMap<>();
        for (Map.Entry<String, Stub> entry : stubs.entrySet()) {
            ReportModel.Spec spec = new ReportModel.Spec();
            spec.specified = entry.getValue().specOk;
            specs.put(labelOf(entry.getKey()), spec);
        }
        return specs;
    }

    /** Proof status per code-name. Stubs without a code-name have nothing to verify and are skipped. */
    public Map<String, ReportModel.ProofStatus> proofs(Map<String, Stub> stubs) {
        Map<String, ReportModel.ProofStatus> proofs = new TreeMap<>();
        for (Stub stub : stubs.values()) {
            if (stub.codeName == null) continue;
            boolean verified = Boolean.TRUE.equals(stub.proofOk);
            ReportModel.ProofStatus status = new ReportModel.ProofStatus();
            status.verified = verified;
            status.status = verified ? SUCCESS : SORRIES;
            proofs.put(stub.codeName, status);
        }
        return proofs;
    }

    /** The label part of a canonical stub name: everything after the last {@code /}. */
    static String labelOf(String stubName) {
        int slash = stubName.lastIndexOf('/');
        return slash >= 0 ? stubName.substring(slash + 1) : stubName;
    }
}
