package com.blueprintprobe;

import com.blueprintprobe.extract.EnvironmentBlock;
import com.blueprintprobe.extract.EnvironmentExtractor;
import com.blueprintprobe.extract.LineIndex;
import com.blueprintprobe.graph.StubModel.LineRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentExtractorTest {

    private static List<EnvironmentBlock> extract(String text, List<String> types, List<String> warnings) {
        return new EnvironmentExtractor(types).extract(text, "file.tex", new LineIndex(text), warnings);
    }

    @Test
    void lineIndexCountsPrecedingNewlines() {
        LineIndex index = new LineIndex("line1\nline2\nline3");
        assertEquals(1, index.lineOf(0));
        assertEquals(1, index.lineOf(5));
        assertEquals(2, index.lineOf(6));
        assertEquals(3, index.lineOf(12));
    }

    @Test
    void blocksOfDifferentTypesInDocumentOrder() {
        String text = """
                \\begin{lemma}\\label{l1}\\end{lemma}
                \\begin{theorem}\\label{t1}\\end{theorem}
                \\begin{lemma}\\label{l2}\\end{lemma}
                """;
        List<EnvironmentBlock> blocks = extract(text, List.of("theorem", "lemma"), new ArrayList<>());
        assertEquals(List.of("lemma", "theorem", "lemma"),
                blocks.stream().map(EnvironmentBlock::type).collect(Collectors.toList()));
        assertEquals(List.of(1, 2, 3),
                blocks.stream().map(b -> b.lines().start()).collect(Collectors.toList()));
    }

    @Test
    void contentAndSpan() {
        String text = "\\begin{theorem}\\label{thm1}\nLine 2 content.\nLine 3 content.\n\\end{theorem}\n";
        List<EnvironmentBlock> blocks = extract(text, List.of("theorem"), new ArrayList<>());
        assertEquals(1, blocks.size());
        EnvironmentBlock block = blocks.get(0);
        assertEquals(new LineRange(1, 4), block.lines());
        assertEquals("\\label{thm1}\nLine 2 content.\nLine 3 content.\n", block.content());
        assertEquals(0, block.start());
        assertEquals(text.indexOf("\\end{theorem}") + "\\end{theorem}".length(), block.end());
        assertEquals("file.tex", block.relativePath());
    }

    @Test
    void unconfiguredEnvironmentsIgnoredButSearchedInside() {
        String text = "\\begin{section}\\begin{lemma}\\label{x}\\end{lemma}\\end{section}\\begin{remark}r\\end{remark}";
        List<EnvironmentBlock> blocks = extract(text, List.of("lemma"), new ArrayList<>());
        assertEquals(1, blocks.size());
        assertEquals("\\label{x}", blocks.get(0).content());
    }

    @Test
    void nestedConfiguredBlockBelongsToOuterBlock() {
        String text = "\\begin{theorem}\\label{outer}\n\\begin{lemma}\\label{inner}\\end{lemma}\n\\end{theorem}";
        List<String> warnings = new ArrayList<>();
        List<EnvironmentBlock> blocks = extract(text, List.of("theorem", "lemma"), warnings);
        assertEquals(1, blocks.size());
        assertEquals("theorem", blocks.get(0).type());
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("\\begin{lemma}"), warnings.get(0));
    }

    @Test
    void unterminatedBlockSkippedWithWarning() {
        String text = "\\begin{theorem}\\label{open}\n\\begin{lemma}\\label{ok}\\end{lemma}";
        List<String> warnings = new ArrayList<>();
        List<EnvironmentBlock> blocks = extract(text, List.of("theorem", "lemma"), warnings);
        assertEquals(1, blocks.size());
        assertEquals("lemma", blocks.get(0).type());
        assertEquals(2, blocks.get(0).lines().start());
        assertTrue(warnings.get(0).contains("unterminated"));
    }

    @Test
    void typeNameMustMatchExactly() {
        String text = "\\begin{theorem*}\\label{star}\\end{theorem*}";
        assertTrue(extract(text, List.of("theorem"), new ArrayList<>()).isEmpty());
    }
}
