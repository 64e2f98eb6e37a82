package org.l3.morpho.cascade;

import org.junit.BeforeClass;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RootFilterTest {

    private static Cascade<?> filter;

    @BeforeClass
    public static void compile() throws Exception {
        filter = CascadeCompiler.compile(Collections.singletonList(CascadeCompilerTest.dataPath("root_filter.fst")));
    }

    @Test
    public void testSegmentsMultiCharacterSymbols() {
        assertEquals(Arrays.asList("bW", "|", "c"), filter.segment("bW|c"));
        assertEquals(Arrays.asList("b", "|", "bW"), filter.segment("b|bW"));
        assertEquals(Arrays.asList("c", "x", "W"), filter.segment("cxW"));
    }

    @Test
    public void testAcceptsDistinctConsonants() {
        assertEquals(1, filter.analyze("b|c").size());
        assertEquals("b|c", filter.analyze("b|c").get(0).getRoot());
        assertEquals(1, filter.analyze("b|bW").size());
        assertEquals(Arrays.asList("b", "|", "bW"), filter.analyze("b|bW").get(0).getSymbols());
        assertEquals(1, filter.analyze("d").size());
    }

    @Test
    public void testRejectsIdenticalConsonants() {
        assertTrue(filter.analyze("b|b").isEmpty());
        assertTrue(filter.analyze("bW|bW").isEmpty());
        assertTrue(filter.analyze("d|d").isEmpty());
    }

    @Test
    public void testTransducerAcceptance() {
        Transducer<?> stage = filter.getStages().get(0);
        assertTrue(stage.accepts(Arrays.asList("c", "|", "bW")));
        assertFalse(stage.accepts(Arrays.asList("c", "|", "c")));
        assertFalse(stage.accepts(Arrays.asList("|")));
    }

    @Test
    public void testUnanalyzableWordsGiveNoResults() {
        assertTrue(filter.analyze("").isEmpty());
        assertTrue(filter.analyze("xyz").isEmpty());
        assertTrue(filter.analyze("b|c|d").isEmpty());
    }
}
