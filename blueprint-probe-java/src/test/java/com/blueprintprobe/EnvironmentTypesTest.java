package com.blueprintprobe;

import com.blueprintprobe.config.EnvironmentTypes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentTypesTest {

    @Test
    void defaultsWhenNoThmsOption() {
        assertEquals(EnvironmentTypes.DEFAULTS,
                EnvironmentTypes.fromWebTex("\\usepackage[showmore, dep_graph]{blueprint}"));
    }

    @Test
    void defaultsWhenPackageAbsent() {
        assertEquals(List.of("definition", "lemma", "proposition", "theorem", "corollary"),
                EnvironmentTypes.fromWebTex("\\documentclass{report}"));
    }

    @Test
    void customThmsOption() {
        assertEquals(List.of("dfn", "lem", "prop", "thm", "cor"),
                EnvironmentTypes.fromWebTex("\\usepackage[thms=dfn+lem+prop+thm+cor]{blueprint}"));
    }

    @Test
    void thmsAmongOtherOptions() {
        assertEquals(List.of("definition", "theorem"),
                EnvironmentTypes.fromWebTex("\\usepackage [showmore, thms = definition+theorem, dep_graph] {blueprint}"));
    }

    @Test
    void commentedOutPackageIgnored() {
        String webTex = "% \\usepackage[thms=dfn]{blueprint}\n\\usepackage{blueprint}";
        assertEquals(EnvironmentTypes.DEFAULTS, EnvironmentTypes.fromWebTex(webTex));
    }

    @Test
    void otherPackagesIgnored() {
        assertEquals(EnvironmentTypes.DEFAULTS, EnvironmentTypes.fromWebTex("\\usepackage[thms=dfn]{other}"));
    }
}
