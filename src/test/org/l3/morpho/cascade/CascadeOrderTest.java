package org.l3.morpho.cascade;

import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CascadeOrderTest {

    private static Map<String, String> phonology() throws Exception {
        return CascadeCompilerTest.sources(
                "delGS", CascadeCompilerTest.readData("delGS.fst"),
                "epen1", CascadeCompilerTest.readData("epen1.fst"),
                "epen2", CascadeCompilerTest.readData("epen2.fst"),
                "simpC", CascadeCompilerTest.readData("simpC.fst"));
    }

    private static final String CLASSES = "C = {b, s, t, r}\nV = {a, e, I}\n";

    @Test
    public void testStagesRunInDeclaredOrder() throws Exception {
        Cascade<?> phon = CascadeCompiler.compile(CascadeCompilerTest.dataPath("phon.cas"));
        List<AnalysisResult> results = phon.analyze("sabb'");
        assertEquals(1, results.size());
        assertEquals("sab", results.get(0).getRoot());
    }

    @Test
    public void testReversedOrderGivesDifferentResult() throws Exception {
        Cascade<?> reversed = CascadeCompiler.compile("rev", CLASSES + ">simpC<\n>delGS<", phonology());
        assertTrue(reversed.analyze("sabb'").isEmpty());
        assertEquals("sab", reversed.analyze("sabb").get(0).getRoot());
    }

    @Test
    public void testEachStageFeedsTheNext() throws Exception {
        Cascade<?> phon = CascadeCompiler.compile("phon", CLASSES + ">delGS<\n>simpC<", phonology());
        assertEquals("sab", phon.analyze("s'a'bb").get(0).getRoot());
        assertEquals("teb", phon.analyze("tebb").get(0).getRoot());
        assertTrue(phon.analyze("tebbx").isEmpty());
    }

    @Test
    public void testEpenthesisStagesRunInDeclaredOrder() throws Exception {
        Cascade<?> phon = CascadeCompiler.compile(CascadeCompilerTest.dataPath("phon.cas"));
        assertEquals("st", phon.analyze("IsIt").get(0).getRoot());
        assertEquals("st", phon.analyze("Is'It").get(0).getRoot());
        assertEquals("st", phon.subcascade("epen").analyze("IsIt").get(0).getRoot());

        // medial I goes first, which leaves the initial I before two consonants
        Cascade<?> swapped = CascadeCompiler.compile("swapped",
                CLASSES + ">delGS<\n>epen1<\n>epen2<\n>simpC<", phonology());
        List<AnalysisResult> results = swapped.analyze("IsIt");
        assertEquals(1, results.size());
        assertEquals("Ist", results.get(0).getRoot());
    }

    @Test
    public void testSubcascades() throws Exception {
        Cascade<?> phon = CascadeCompiler.compile(CascadeCompilerTest.dataPath("phon.cas"));
        Cascade<?> gs = phon.subcascade("gs");
        assertEquals("gs", gs.getName());
        assertEquals(1, gs.getStages().size());
        assertEquals("sabb", gs.analyze("sabb'").get(0).getRoot());
        assertEquals("sab", phon.subcascade("simp").analyze("sabb").get(0).getRoot());
        assertTrue(phon.subcascade("simp").analyze("sabb'").isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownSubcascade() throws Exception {
        CascadeCompiler.compile(CascadeCompilerTest.dataPath("phon.cas")).subcascade("nope");
    }
}
