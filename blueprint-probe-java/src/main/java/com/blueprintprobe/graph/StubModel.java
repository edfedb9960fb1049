package com.blueprintprobe.graph;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs of the stubs.json document.
 * Field names use @SerializedName for the kebab-case JSON keys; null fields are omitted on write.
 */
public final class StubModel {

    private StubModel() {}

    /** 1-indexed, inclusive line span. */
    public record LineRange(
        @SerializedName("lines-start") int start,
        @SerializedName("lines-end")   int end
    ) {}

    public static class Stub {
        @SerializedName("stub-type")          public String stubType;
        @SerializedName("stub-path")          public String stubPath;
        @SerializedName("stub-spec")          public LineRange stubSpec;
        @SerializedName("stub-proof")         public LineRange stubProof;        // nullable
        @SerializedName("labels")             public List<String> labels;
        @SerializedName("code-name")          public String codeName;            // nullable
        @SerializedName("code-names")         public List<String> codeNames;     // only when more than one
        @SerializedName("spec-ok")            public boolean specOk;
        @SerializedName("mathlib-ok")         public boolean mathlibOk;
        @SerializedName("not-ready")          public boolean notReady;
        @SerializedName("discussion")         public List<String> discussion;    // nullable
        @SerializedName("spec-dependencies")  public List<String> specDependencies;
        @SerializedName("proof-code-name")    public String proofCodeName;
        @SerializedName("proof-code-names")   public List<String> proofCodeNames;
        @SerializedName("proof-ok")           public Boolean proofOk;            // null or true
        @SerializedName("proof-mathlib-ok")   public Boolean proofMathlibOk;     // null or true
        @SerializedName("proof-not-ready")    public Boolean proofNotReady;      // null or true
        @SerializedName("proof-discussion")   public List<String> proofDiscussion;
        @SerializedName("proof-dependencies") public List<String> proofDependencies;
    }
}
