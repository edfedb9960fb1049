package com.blueprintprobe.extract;

import com.blueprintprobe.graph.StubModel.LineRange;

/**
 * A {@code \begin{proof}...\end{proof}} block: its span and its macro payload.
 */
public record ProofBlock(LineRange lines, Annotations annotations) {}
