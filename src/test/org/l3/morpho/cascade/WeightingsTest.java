package org.l3.morpho.cascade;

import org.junit.Test;
import org.l3.morpho.cascade.fs.FeatureStructure;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class WeightingsTest {

    // counts the transitions that carry a weight
    private static final class CountWeighting implements Weighting<Integer> {

        @Override
        public String name() {
            return "Count";
        }

        @Override
        public Integer one() {
            return 0;
        }

        @Override
        public List<Integer> parse(String text) {
            return Collections.singletonList(1);
        }

        @Override
        public Integer combine(Integer left, Integer right) {
            return left + right;
        }

        @Override
        public double score(Integer weight, String form, FrequencySource frequencies) {
            return weight;
        }

        @Override
        public int compare(Integer left, Integer right) {
            return 0;
        }

        @Override
        public FeatureStructure features(Integer weight) {
            return FeatureStructure.EMPTY;
        }
    }

    private static List<String> roots(List<AnalysisResult> results) {
        String[] roots = new String[results.size()];
        for (int i = 0; i < roots.length; i++) {
            roots[i] = results.get(i).getRoot();
        }
        return Arrays.asList(roots);
    }

    @Test
    public void testUnification() {
        UnificationWeighting w = UnificationWeighting.INSTANCE;
        assertSame(FeatureStructure.EMPTY, w.one());
        assertEquals(2, w.parse("[num=sg|pl]").size());
        assertNull(w.combine(FeatureStructure.parse("[+def]"), FeatureStructure.parse("[-def]")));
        assertTrue(w.compare(FeatureStructure.parse("[a=1,b=2]"), FeatureStructure.parse("[a=1]")) < 0);
        assertEquals(0, w.score(FeatureStructure.parse("[a=1]"), "sbr", null), 0);
        try {
            w.parse("[num=");
            fail("bad structure accepted");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("at pos"));
        }
    }

    @Test
    public void testProbability() {
        ProbabilityWeighting w = ProbabilityWeighting.INSTANCE;
        assertEquals(1.0, w.one(), 0);
        assertEquals(Arrays.asList(0.5, 0.25), w.parse("[0.5;0.25]"));
        assertEquals(Collections.singletonList(1.0), w.parse("[]"));
        assertEquals(0.125, w.combine(0.5, 0.25), 0);
        assertNull(w.combine(0.5, 0.0));
        assertTrue(w.compare(0.5, 0.25) < 0);
        for (String bad : Arrays.asList("[-0.5]", "[x]", "[NaN]")) {
            try {
                w.parse(bad);
                fail("accepted " + bad);
            } catch (IllegalArgumentException e) {
                assertTrue(e.getMessage().contains(bad));
            }
        }
    }

    @Test
    public void testTropical() {
        TropicalWeighting w = TropicalWeighting.INSTANCE;
        assertEquals(0.0, w.one(), 0);
        assertEquals(3.5, w.combine(1.5, 2.0), 0);
        assertEquals(Arrays.asList(-1.0), w.parse("[-1]"));
        assertTrue(w.compare(1.0, 2.0) < 0);
        assertEquals(-2.0, w.score(2.0, "x", null), 0);
    }

    @Test
    public void testProbabilityCascade() throws Exception {
        Cascade<?> p = CascadeCompiler.compile("p", "weighting = PROBABILITY\n>p<", CascadeCompilerTest.sources("p",
                "s -> e [a:x] [0.25]\ns -> e [a:y] [0.5]\ns -> e [b:z] [0]\ns -> m [c:u] [0.5]\nm -> e [d:v] [0.5]\ne ->"));
        List<AnalysisResult> results = p.analyze("a");
        assertEquals(Arrays.asList("y", "x"), roots(results));
        assertEquals(0.5, results.get(0).getScore(), 0);
        assertEquals(FeatureStructure.EMPTY, results.get(0).getFeatures());
        assertTrue(p.analyze("b").isEmpty());
        assertEquals(0.25, p.analyze("cd").get(0).getScore(), 0);
    }

    @Test
    public void testTropicalCascade() throws Exception {
        Cascade<?> t = CascadeCompiler.compile("t", "weighting = TROPICAL\n>t<", CascadeCompilerTest.sources("t",
                "s -> e [a:x] [2]\ns -> e [a:y] [1;3]\ne ->"));
        List<AnalysisResult> results = t.analyze("a");
        assertEquals(Arrays.asList("y", "x", "y"), roots(results));
        assertEquals(-1.0, results.get(0).getScore(), 0);
        assertEquals(-3.0, results.get(2).getScore(), 0);
    }

    @Test
    public void testRegisteredWeighting() throws Exception {
        CountWeighting count = new CountWeighting();
        Configuration configuration = new Configuration.Builder().withWeighting(count).build();
        assertSame(count, configuration.getWeighting("COUNT"));
        assertSame(UnificationWeighting.INSTANCE, configuration.getWeighting("unification"));
        assertNull(configuration.getWeighting("fuzzy"));

        Cascade<?> c = CascadeCompiler.compile("c", "weighting = count\n>c<",
                CascadeCompilerTest.sources("c", "s -> m [a] [w]\nm -> e [b] [w]\ns -> e [a:x]\ne -> e [b]\ne ->"),
                configuration);
        assertSame(count, c.getWeighting());
        List<AnalysisResult> results = c.analyze("ab");
        assertEquals(Arrays.asList("ab", "xb"), roots(results));
        assertEquals(2, results.get(0).getScore(), 0);
        assertEquals(0, results.get(1).getScore(), 0);
    }
}
