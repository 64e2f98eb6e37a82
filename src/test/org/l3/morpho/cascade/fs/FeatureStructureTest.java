package org.l3.morpho.cascade.fs;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FeatureStructureTest {

    private static final String[] SAMPLES = {
            "[]",
            "[+def]",
            "[-def]",
            "[num=sg]",
            "[num=pl,+def]",
            "[sb=3,tam=imf]",
            "[poss=[p=1,n=sg]]",
            "[poss=[p=1],num=sg]",
            "[poss=[p=2]]",
    };

    @Test
    public void testParseAndPrint() {
        FeatureStructure fs = FeatureStructure.parse("[num=pl, +def, poss=[p=1, n=sg]]");
        assertEquals("[+def,num=pl,poss=[n=sg,p=1]]", fs.toString());
        assertEquals(fs, FeatureStructure.parse(fs.toString()));
        assertEquals(3, fs.size());
        assertEquals("pl", fs.getAtom("num"));
        assertEquals(FlagValue.PLUS, fs.get("def"));
        assertTrue(FlagValue.PLUS.isSet());
        assertFalse(FlagValue.MINUS.isSet());
        assertNull(fs.getAtom("def"));
        assertEquals(AtomValue.of("1"), fs.getPath("poss.p"));
        assertNull(fs.getPath("num.p"));
        assertNull(fs.getPath("missing.p"));
    }

    @Test
    public void testEmpty() {
        assertSame(FeatureStructure.EMPTY, FeatureStructure.parse("[]"));
        assertTrue(FeatureStructure.EMPTY.isEmpty());
        assertEquals("[]", FeatureStructure.EMPTY.toString());
        assertEquals(0, FeatureStructure.EMPTY.specificity());
    }

    @Test
    public void testUnifyMergesAndFails() {
        FeatureStructure a = FeatureStructure.parse("[sb=3,tam=imf]");
        FeatureStructure b = FeatureStructure.parse("[sb=3,num=pl]");
        FeatureStructure c = FeatureStructure.parse("[sb=2]");
        assertEquals(FeatureStructure.parse("[num=pl,sb=3,tam=imf]"), a.unify(b));
        assertNull(a.unify(c));
        assertFalse(b.unifiesWith(c));
        assertNull(FeatureStructure.parse("[+def]").unify(FeatureStructure.parse("[-def]")));
        assertNull(FeatureStructure.parse("[def=yes]").unify(FeatureStructure.parse("[+def]")));
    }

    @Test
    public void testUnifyNested() {
        FeatureStructure a = FeatureStructure.parse("[poss=[p=1]]");
        FeatureStructure b = FeatureStructure.parse("[poss=[n=sg],num=pl]");
        assertEquals(FeatureStructure.parse("[num=pl,poss=[n=sg,p=1]]"), a.unify(b));
        assertNull(a.unify(FeatureStructure.parse("[poss=[p=2]]")));
        assertNull(a.unify(FeatureStructure.parse("[poss=x]")));
    }

    @Test
    public void testUnificationIsCommutativeAssociativeAndIdempotent() {
        for (String sa : SAMPLES) {
            FeatureStructure a = FeatureStructure.parse(sa);
            assertEquals(sa, a, a.unify(a));
            assertEquals(sa, a, a.unify(FeatureStructure.EMPTY));
            assertEquals(sa, a, FeatureStructure.EMPTY.unify(a));
            for (String sb : SAMPLES) {
                FeatureStructure b = FeatureStructure.parse(sb);
                assertEquals(sa + " " + sb, a.unify(b), b.unify(a));
                for (String sc : SAMPLES) {
                    FeatureStructure c = FeatureStructure.parse(sc);
                    FeatureStructure ab = a.unify(b);
                    FeatureStructure bc = b.unify(c);
                    FeatureStructure left = ab == null ? null : ab.unify(c);
                    FeatureStructure right = bc == null ? null : a.unify(bc);
                    assertEquals(sa + " " + sb + " " + sc, left, right);
                }
            }
        }
    }

    @Test
    public void testWithout() {
        FeatureStructure fs = FeatureStructure.parse("[num=pl,sb=3]");
        assertEquals(FeatureStructure.parse("[num=pl]"), fs.without("sb"));
        assertSame(fs, fs.without("tam"));
        assertSame(FeatureStructure.EMPTY, fs.without("sb").without("num"));
    }

    @Test
    public void testAttributes() {
        FeatureStructure fs = FeatureStructure.parse("[-def,num=pl,poss=[p=1,+pl]]");
        assertEquals(Arrays.asList("-def", "num=pl", "poss.p=1", "+poss.pl"), fs.attributes());
        assertEquals(4, fs.specificity());
    }

    @Test
    public void testBuilder() {
        FeatureStructure built = FeatureStructure.builder()
                .atom("num", "pl")
                .flag("def", true)
                .nested("poss", FeatureStructure.builder().atom("p", "1").build())
                .build();
        assertEquals(FeatureStructure.parse("[+def,num=pl,poss=[p=1]]"), built);
        assertEquals(FeatureStructure.parse("[+def,num=pl,poss=[p=1]]").hashCode(), built.hashCode());
        assertSame(FeatureStructure.EMPTY, FeatureStructure.builder().build());
        try {
            FeatureStructure.builder().atom("num", "pl").atom("num", "sg");
            fail("duplicate attribute accepted");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("num"));
        }
    }

    @Test(expected = FeatureStructureParseException.class)
    public void testParseRejectsAlternatives() {
        FeatureStructure.parse("[num=sg|pl]");
    }
}
