package org.l3.morpho.cascade;

import org.junit.Test;
import org.l3.morpho.cascade.fs.FeatureStructure;

import java.time.Duration;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SearchBudgetTest {

    private static final String AMBIGUOUS = "s -> s [a;a:b]\ns ->";

    private static Cascade<FeatureStructure> ambiguous(Configuration configuration) throws Exception {
        return CascadeCompiler.compile("amb", ">amb<", CascadeCompilerTest.sources("amb", AMBIGUOUS),
                configuration).withWeighting(UnificationWeighting.INSTANCE);
    }

    private static Cascade<FeatureStructure> twoStages(Configuration configuration) throws Exception {
        return CascadeCompiler.compile("two", ">amb<\n>id<",
                CascadeCompilerTest.sources("amb", AMBIGUOUS, "id", "s -> s [a;b]\ns ->"),
                configuration).withWeighting(UnificationWeighting.INSTANCE);
    }

    // steps a complete search of the word takes
    private static long stepsFor(Cascade<FeatureStructure> cascade, String word) {
        Transduction<FeatureStructure> task = new Transduction<>(UnificationWeighting.INSTANCE, cascade.getStages(),
                null, cascade.getConfiguration());
        PathFinder.find(task, cascade.segment(word), UnificationWeighting.INSTANCE.one());
        assertFalse(task.isExhausted());
        return task.getSteps();
    }

    @Test
    public void testMemoizedSearchFindsAllPaths() throws Exception {
        Cascade<?> cascade = ambiguous(Configuration.defaults());
        assertEquals(1024, cascade.analyze("aaaaaaaaaa").size());
        assertEquals(5, cascade.analyze("aaaaaaaaaa", 5).size());
    }

    @Test
    public void testExhaustedBudgetReturnsPartialResults() throws Exception {
        String word = "aaaaaa";
        List<AnalysisResult> all = ambiguous(Configuration.defaults()).analyze(word);
        assertEquals(64, all.size());
        long needed = stepsFor(ambiguous(Configuration.defaults()), word);
        for (long maxSteps = 1; maxSteps < needed; maxSteps++) {
            Cascade<?> limited = ambiguous(new Configuration.Builder().withMaxSteps(maxSteps).build());
            List<AnalysisResult> partial = limited.analyze(word);
            assertTrue(partial.size() < all.size());
            assertTrue(all.containsAll(partial));
        }
        assertFalse(ambiguous(new Configuration.Builder().withMaxSteps(needed / 2).build()).analyze(word).isEmpty());
        assertEquals(all, ambiguous(new Configuration.Builder().withMaxSteps(needed).build()).analyze(word));
    }

    @Test
    public void testLaterStagesReceivePartialResults() throws Exception {
        String word = "aaaaaa";
        List<AnalysisResult> all = twoStages(Configuration.defaults()).analyze(word);
        assertEquals(64, all.size());
        long needed = stepsFor(twoStages(Configuration.defaults()), word);
        List<AnalysisResult> partial = twoStages(new Configuration.Builder().withMaxSteps(needed / 2).build())
                .analyze(word);
        assertFalse(partial.isEmpty());
        assertTrue(partial.size() < all.size());
        assertTrue(all.containsAll(partial));
    }

    @Test
    public void testBudgetBoundsExponentialOutput() throws Exception {
        Cascade<?> limited = ambiguous(new Configuration.Builder().withMaxSteps(100).build());
        List<AnalysisResult> partial = limited.analyze("aaaaaaaaaaaaaaaaaaa");
        assertFalse(partial.isEmpty());
        assertTrue(partial.size() < 100);
    }

    @Test
    public void testTimeoutReturnsPartialResults() throws Exception {
        Cascade<?> cascade = ambiguous(new Configuration.Builder()
                .withMaxSteps(Long.MAX_VALUE)
                .withTimeout(Duration.ofMillis(50))
                .build());
        long started = System.nanoTime();
        List<AnalysisResult> partial = cascade.analyze("aaaaaaaaaaaaaaaaaaaaaa");
        assertTrue(partial.size() < 1 << 22);
        assertTrue(System.nanoTime() - started < Duration.ofSeconds(10).toNanos());
    }

    @Test
    public void testGenerousTimeoutChangesNothing() throws Exception {
        Cascade<?> cascade = ambiguous(new Configuration.Builder().withTimeout(Duration.ofMinutes(1)).build());
        assertEquals(Duration.ofMinutes(1), cascade.getConfiguration().getTimeout());
        assertEquals(64, cascade.analyze("aaaaaa").size());
    }

    @Test
    public void testEpsilonCyclesTerminate() throws Exception {
        Cascade<?> cascade = CascadeCompiler.compile("cyc", ">cyc<",
                CascadeCompilerTest.sources("cyc", "a -> b\nb -> a\na -> a [x]\nb -> c [:y]\nc -> a\na ->"));
        List<AnalysisResult> results = cascade.analyze("xx");
        assertTrue(results.size() >= 1);
        assertEquals("xx", results.get(0).getRoot().replace("y", ""));
        assertTrue(cascade.analyze("").size() >= 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMaxStepsMustBePositive() {
        new Configuration.Builder().withMaxSteps(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTimeoutMustBePositive() {
        new Configuration.Builder().withTimeout(Duration.ZERO);
    }
}
