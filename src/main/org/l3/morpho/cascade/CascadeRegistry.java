package org.l3.morpho.cascade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiled cascades by name, e.g. one per part of speech of a language. Cascades may be registered and dropped
 * while other threads analyze.
 */
@ThreadSafe
public class CascadeRegistry {

    private static final Logger log = LoggerFactory.getLogger(CascadeRegistry.class);

    private final Map<String, Cascade<?>> cascades = new ConcurrentHashMap<>();

    /**
     * Register a cascade under its own name.
     *
     * @return the cascade previously registered under that name, or null
     */
    @Nullable
    public Cascade<?> register(final Cascade<?> cascade) {
        return register(cascade.getName(), cascade);
    }

    @Nullable
    public Cascade<?> register(final String name, final Cascade<?> cascade) {
        Cascade<?> previous = cascades.put(name, cascade);
        if (previous != null) {
            log.info("Replaced cascade {}", name);
        }
        return previous;
    }

    @Nullable
    public Cascade<?> get(final String name) {
        return cascades.get(name);
    }

    /**
     * @return true if a cascade was registered under this name
     */
    public boolean drop(final String name) {
        return cascades.remove(name) != null;
    }

    public Set<String> names() {
        return new TreeSet<>(cascades.keySet());
    }

    public boolean isEmpty() {
        return cascades.isEmpty();
    }

    public List<AnalysisResult> analyze(final String word) {
        return analyze(word, Cascade.ALL, null);
    }

    /**
     * Analyze a word with every registered cascade and merge the results, best score first. Among equal scores the
     * analysis with more specific features comes first, then the order of the cascade names.
     */
    public List<AnalysisResult> analyze(final String word, final int nbest,
                                        @Nullable final FrequencySource frequencies) {
        Ranker.checkNbest(nbest);
        List<AnalysisResult> merged = new ArrayList<>();
        for (String name : names()) {
            Cascade<?> cascade = cascades.get(name);
            if (cascade != null) {
                merged.addAll(cascade.analyze(word, nbest, frequencies));
            }
        }
        merged.sort(Comparator.comparingDouble(AnalysisResult::getScore).reversed()
                .thenComparing((a, b) -> Integer.compare(b.getFeatures().specificity(),
                        a.getFeatures().specificity())));
        return merged.size() > nbest ? new ArrayList<>(merged.subList(0, nbest)) : merged;
    }
}
