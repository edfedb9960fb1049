package com.blueprintprobe.extract;

import java.util.List;

/**
 * Macro payload read from one block body: the fields statements and proofs share.
 *
 * @param labels      top-level {@code \label}s in declaration order
 * @param codeNames   entries of {@code \lean}, primary first
 * @param leanOk      {@code \leanok} present
 * @param mathlibOk   {@code \mathlibok} present
 * @param notReady    {@code \notready} present
 * @param discussions every {@code \discussion} argument, in order
 * @param uses        entries of {@code &#92;uses}
 * @param proves      entries of {@code \proves}
 */
public record Annotations(
    List<String> labels,
    List<String> codeNames,
    boolean leanOk,
    boolean mathlibOk,
    boolean notReady,
    List<String> discussions,
    List<String> uses,
    List<String> proves
) {

    public Annotations {
        labels = List.copyOf(labels);
        codeNames = List.copyOf(codeNames);
        discussions = List.copyOf(discussions);
        uses = List.copyOf(uses);
        proves = List.copyOf(proves);
    }

    public String primaryCodeName() {
        return codeNames.isEmpty() ? null : codeNames.get(0);
    }

    public boolean hasBackReference() {
        return !proves.isEmpty();
    }
}
