package com.blueprintprobe.extract;

import com.blueprintprobe.graph.StubModel.LineRange;

import java.util.List;

/**
 * A proof that names its targets with {@code \proves} instead of following them.
 */
public record StandaloneProof(String relativePath, ProofBlock proof) {

    public LineRange lines() {
        return proof.lines();
    }

    public List<String> targets() {
        return proof.annotations().proves();
    }
}
