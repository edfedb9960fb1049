package com.blueprintprobe;

import com.blueprintprobe.graph.StubModel.LineRange;
import com.blueprintprobe.graph.StubModel.Stub;
import com.blueprintprobe.report.ReportBuilder;
import com.blueprintprobe.report.ReportModel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportBuilderTest {

    private final ReportBuilder builder = new ReportBuilder();

    private static Stub stub(String path, String codeName, boolean specOk, Boolean proofOk) {
        Stub stub = new Stub();
        stub.stubType = "lemma";
        stub.stubPath = path;
        stub.stubSpec = new LineRange(1, 3);
        stub.codeName = codeName;
        stub.specOk = specOk;
        stub.proofOk = proofOk;
        stub.specDependencies = new ArrayList<>();
        return stub;
    }

    private static Map<String, Stub> graph() {
        Map<String, Stub> stubs = new LinkedHashMap<>();
        Stub base = stub("a.tex", "Base", true, Boolean.TRUE);
        Stub top = stub("b/c.tex", "Top", false, null);
        top.specDependencies = List.of("a.tex/base");
        top.proofDependencies = List.of("a.tex/helper");
        Stub helper = stub("a.tex", null, false, null);
        stubs.put("b/c.tex/top", top);
        stubs.put("a.tex/base", base);
        stubs.put("a.tex/helper", helper);
        return stubs;
    }

    @Test
    void atomsKeyedByLabel() {
        Map<String, ReportModel.Atom> atoms = builder.atoms(graph());

        assertEquals(List.of("base", "helper", "top"), new ArrayList<>(atoms.keySet()));
        ReportModel.Atom top = atoms.get("top");
        assertEquals("top", top.displayName);
        assertEquals("b/c.tex", top.stubPath);
        assertEquals(new LineRange(1, 3), top.stubText);
    }

    @Test
    void atomDependenciesListSpecBeforeProof() {
        ReportModel.Atom top = builder.atoms(graph()).get("top");
        assertEquals(List.of("a.tex/base", "a.tex/helper"), top.dependencies);
        assertTrue(builder.atoms(graph()).get("base").dependencies.isEmpty());
    }

    @Test
    void specsReflectLeanOk() {
        Map<String, ReportModel.Spec> specs = builder.specs(graph());
        assertEquals(3, specs.size());
        assertTrue(specs.get("base").specified);
        assertFalse(specs.get("top").specified);
        assertFalse(specs.get("helper").specified);
    }

    @Test
    void proofsKeyedByCodeName() {
        Map<String, ReportModel.ProofStatus> proofs = builder.proofs(graph());

        assertEquals(List.of("Base", "Top"), new ArrayList<>(proofs.keySet()));
        assertTrue(proofs.get("Base").verified);
        assertEquals("success", proofs.get("Base").status);
        assertFalse(proofs.get("Top").verified);
        assertEquals("sorries", proofs.get("Top").status);
    }

    @Test
    void emptyGraphGivesEmptyReports() {
        assertTrue(builder.atoms(Map.of()).isEmpty());
        assertTrue(builder.specs(Map.of()).isEmpty());
        assertTrue(builder.proofs(Map.of()).isEmpty());
    }
}
