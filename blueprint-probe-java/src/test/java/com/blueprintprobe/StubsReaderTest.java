package com.blueprintprobe;

import com.blueprintprobe.graph.StubModel.LineRange;
import com.blueprintprobe.graph.StubModel.Stub;
import com.blueprintprobe.graph.StubSerializer;
import com.blueprintprobe.report.StubsReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StubsReaderTest {

    private final StubsReader reader = new StubsReader();

    @Test
    void missingFileThrows(@TempDir Path tmp) {
        StubsReader.StubsReadException e = assertThrows(StubsReader.StubsReadException.class,
                () -> reader.read(tmp.resolve("stubs.json")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void emptyFileThrows(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("stubs.json");
        Files.writeString(file, "");
        assertThrows(StubsReader.StubsReadException.class, () -> reader.read(file));
    }

    @Test
    void malformedFileThrows(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("stubs.json");
        Files.writeString(file, "{\"a.tex/x\": [");
        assertThrows(StubsReader.StubsReadException.class, () -> reader.read(file));
    }

    @Test
    void readsWhatStubifyWrites(@TempDir Path tmp) {
        Stub stub = new Stub();
        stub.stubType = "theorem";
        stub.stubPath = "a.tex";
        stub.stubSpec = new LineRange(2, 4);
        stub.stubProof = new LineRange(6, 8);
        stub.labels = List.of("main");
        stub.codeName = "Main";
        stub.specOk = true;
        stub.specDependencies = List.of("a.tex/base");
        stub.proofOk = Boolean.TRUE;
        Path file = tmp.resolve(".verilib/stubs.json");
        new StubSerializer().write(Map.of("a.tex/main", stub), file, Map.of());

        Stub read = reader.read(file).get("a.tex/main");
        assertEquals("theorem", read.stubType);
        assertEquals(new LineRange(2, 4), read.stubSpec);
        assertEquals(new LineRange(6, 8), read.stubProof);
        assertEquals("Main", read.codeName);
        assertTrue(read.specOk);
        assertFalse(read.notReady);
        assertEquals(Boolean.TRUE, read.proofOk);
        assertNull(read.proofMathlibOk);
        assertEquals(List.of("a.tex/base"), read.specDependencies);
    }
}
