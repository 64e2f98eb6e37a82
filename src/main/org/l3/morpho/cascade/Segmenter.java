package org.l3.morpho.cascade;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits a word into the symbols of an alphabet, taking the longest known symbol at each position. Characters that
 * start no known symbol become one-character symbols, so segmentation never fails.
 */
@Immutable
final class Segmenter {

    private final Set<String> symbols;
    private final int longest;

    Segmenter(final Collection<String> alphabet) {
        Set<String> known = new HashSet<>();
        int max = 1;
        for (String symbol : alphabet) {
            if (!symbol.isEmpty()) {
                known.add(symbol);
                max = Math.max(max, symbol.length());
            }
        }
        this.symbols = Collections.unmodifiableSet(known);
        this.longest = max;
    }

    List<String> segment(final String word) {
        List<String> result = new ArrayList<>();
        int pos = 0;
        while (pos < word.length()) {
            int end = Math.min(word.length(), pos + longest);
            while (end > pos + 1 && !symbols.contains(word.substring(pos, end))) {
                end--;
            }
            // a lone surrogate pair half is never a symbol of its own
            if (end == pos + 1 && Character.isHighSurrogate(word.charAt(pos)) && end < word.length()) {
                end++;
            }
            result.add(word.substring(pos, end));
            pos = end;
        }
        return result;
    }
}
