package org.l3.morpho.cascade;

import org.junit.Test;
import org.l3.morpho.cascade.fs.FeatureStructure;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CascadeCompilerTest {

    public static Path dataPath(String name) {
        String wd = System.getProperty("user.dir");
        return FileSystems.getDefault().getPath(wd, "src", "test", "data", name);
    }

    public static String readData(String name) throws Exception {
        return new String(Files.readAllBytes(dataPath(name)), "UTF-8");
    }

    static Map<String, String> sources(String... namesAndTexts) {
        Map<String, String> map = new HashMap<>();
        for (int i = 0; i < namesAndTexts.length; i += 2) {
            map.put(namesAndTexts[i], namesAndTexts[i + 1]);
        }
        return map;
    }

    @Test
    public void testCompileFromFiles() throws Exception {
        Cascade<?> phon = CascadeCompiler.compile(dataPath("phon.cas"));
        assertEquals("phon", phon.getName());
        assertSame(UnificationWeighting.INSTANCE, phon.getWeighting());
        assertEquals(4, phon.getStages().size());
        assertEquals("delGS.fst", phon.getStages().get(0).getName());
        assertEquals("epen2.fst", phon.getStages().get(1).getName());
        assertEquals("epen1.fst", phon.getStages().get(2).getName());
        assertEquals("simpC.fst", phon.getStages().get(3).getName());
        assertEquals(Arrays.asList("gs", "epen", "simp"), Arrays.asList(phon.getSubcascadeNames().toArray()));
        assertNull(CascadeCompiler.check(dataPath("phon.cas")));
    }

    @Test
    public void testCompileRuleFileList() throws Exception {
        Cascade<?> cascade = CascadeCompiler.compile(Collections.singletonList(dataPath("mtax.fst")));
        assertEquals("mtax", cascade.getName());
        assertEquals(1, cascade.getStages().size());
        assertSame(UnificationWeighting.INSTANCE, cascade.getWeighting());
        assertEquals(1, cascade.analyze("ysbru").size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCompileEmptyRuleFileList() throws Exception {
        CascadeCompiler.compile(Collections.<Path>emptyList());
    }

    @Test
    public void testDefaultWeightingIsUnification() throws Exception {
        Cascade<?> cascade = CascadeCompiler.compile("c", ">a<", sources("a", "s -> t [x]\nt ->"));
        assertSame(UnificationWeighting.INSTANCE, cascade.getWeighting());
    }

    @Test
    public void testWeightingNameIgnoresCase() throws Exception {
        Cascade<?> cascade = CascadeCompiler.compile("c", "weighting = tropical\n>a<",
                sources("a", "s -> t [x] [1.5]\nt ->"));
        assertSame(TropicalWeighting.INSTANCE, cascade.getWeighting());
    }

    @Test
    public void testUnknownWeighting() {
        try {
            CascadeCompiler.compile("c", "\nweighting = fuzzy\n>a<", sources("a", "s -> t [x]\nt ->"));
            fail("unknown weighting accepted");
        } catch (UnknownWeightModeException e) {
            assertEquals("fuzzy", e.getMode());
            assertEquals("c.cas:2: Unknown weighting mode fuzzy", e.getMessage());
        } catch (CompileException e) {
            fail("wrong exception " + e);
        }
    }

    @Test
    public void testMissingStage() {
        String message = CascadeCompiler.check("c", ">a<\n>nowhere<", sources("a", "s -> t [x]\nt ->"));
        assertEquals("c.cas:2: No rule file for stage nowhere", message);
    }

    @Test
    public void testMissingStageFile() throws Exception {
        Path cas = Files.createTempFile("missing", ".cas");
        try {
            Files.write(cas, ">notThere<\n".getBytes("UTF-8"));
            String message = CascadeCompiler.check(cas);
            assertTrue(message, message.endsWith(":1: No rule file for stage notThere"));
        } finally {
            Files.delete(cas);
        }
    }

    @Test
    public void testSubcascadeIndexOutOfRange() {
        String message = CascadeCompiler.check("c", ">a<\ncascade x = {0, 1}", sources("a", "s -> t [x]\nt ->"));
        assertEquals("c.cas:2: Stage index 1 out of range in cascade x; there are 1 stages", message);
    }

    @Test
    public void testDuplicateSubcascade() {
        String message = CascadeCompiler.check("c", ">a<\ncascade x = {0}\ncascade x = {0}",
                sources("a", "s -> t [x]\nt ->"));
        assertEquals("c.cas:3: Cascade x declared twice", message);
    }

    @Test
    public void testAllErrorsAreReported() {
        String rules = "X = {a, b}\n" +
                "Y = {c}\n" +
                "Z = Nothing - {a}\n" +
                "s -> t [X:Y]\n" +
                "s -> t [W-a]\n" +
                "s -> t [a] [num=]\n" +
                "t ->\n";
        try {
            CascadeCompiler.compile("c", ">a<\n>b<", sources("a", rules, "b", "s -> [x]"));
            fail("bad rules accepted");
        } catch (CompileException e) {
            assertTrue(e instanceof UndefinedClassException);
            assertEquals("a.fst:3: Undefined class Nothing", e.getMessage());
            Throwable[] others = e.getSuppressed();
            assertEquals(4, others.length);
            assertTrue(others[0] instanceof MalformedAutomatonException);
            assertEquals(4, ((CompileException) others[0]).getLine());
            assertTrue(others[1] instanceof MalformedAutomatonException);
            assertEquals("a.fst:5: Cannot subtract from W, which is not a class", others[1].getMessage());
            assertTrue(others[2] instanceof SyntaxException);
            assertEquals(6, ((CompileException) others[2]).getLine());
            assertTrue(others[3] instanceof SyntaxException);
            assertEquals("b.fst:1: Labels without a target state", others[3].getMessage());
        }
    }

    @Test
    public void testCascadeClassesAreSharedAndShadowed() throws Exception {
        String cas = "C = {b, s}\n>shared<\n>shadow<";
        Map<String, String> fsts = sources(
                "shared", "s -> s [C]\ns ->",
                "shadow", "C = {b}\ns -> s [C]\ns ->");
        Cascade<?> cascade = CascadeCompiler.compile("c", cas, fsts);
        assertEquals(1, cascade.analyze("bb").size());
        assertTrue(cascade.analyze("sb").isEmpty());
    }

    @Test
    public void testClassesDeclaredAfterAStageAreNotVisibleToIt() {
        String message = CascadeCompiler.check("c", ">a<\nC = {b}", sources("a", "D = C - b\ns ->"));
        assertEquals("a.fst:1: Undefined class C", message);
    }

    @Test
    public void testNoFinalStateStillCompiles() throws Exception {
        Cascade<?> cascade = CascadeCompiler.compile("c", ">a<", sources("a", "s -> t [x]"));
        assertTrue(cascade.analyze("x").isEmpty());
    }

    @Test
    public void testWithWeighting() throws Exception {
        Cascade<?> compiled = CascadeCompiler.compile(dataPath("verb.cas"));
        Cascade<FeatureStructure> verb = compiled.withWeighting(UnificationWeighting.INSTANCE);
        assertEquals(Arrays.asList("ysbru"), verb.generate("sbr", FeatureStructure.parse("[tam=imf,num=pl]")));
        try {
            compiled.withWeighting(TropicalWeighting.INSTANCE);
            fail("wrong weighting accepted");
        } catch (IllegalArgumentException e) {
            assertEquals("Cascade verb uses weighting UNIFICATION, not TROPICAL", e.getMessage());
        }
    }

    @Test
    public void testCheckReportsValidSources() {
        List<String> ok = Arrays.asList(
                "s -> t [x]\nt ->",
                "-> t\ns -> t [x:]\nt -> s [:y] [+f]\nt ->",
                "X = {a,b}\nY = X - a\ns -> s [Y;X:c;c:X]\ns ->");
        for (String rules : ok) {
            assertNull(rules, CascadeCompiler.check("c", ">a<", sources("a", rules)));
        }
    }
}
