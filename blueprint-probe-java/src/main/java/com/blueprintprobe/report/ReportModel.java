package com.blueprintprobe.report;

import com.blueprintprobe.graph.StubModel.LineRange;
import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs of the documents derived from stubs.json: atoms.json, specs.json and proofs.json.
 */
public final class ReportModel {

    private ReportModel() {}

    public static class Atom {
        @SerializedName("display-name") public String displayName;
        @SerializedName("dependencies") public List<String> dependencies;
        @SerializedName("stub-path")    public String stubPath;
        @SerializedName("stub-text")    public LineRange stubText;
    }

    public static class Spec {
        @SerializedName("specified") public boolean specified;
    }

    public static class ProofStatus {
        @SerializedName("verified") public boolean verified;
        @SerializedName("status")   public String status;    // "success" or "sorries"
    }
}
