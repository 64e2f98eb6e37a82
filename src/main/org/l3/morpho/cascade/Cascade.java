package org.l3.morpho.cascade;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered list of transducers sharing one weighting mode. Analysis runs the stages left to right from surface
 * form to root and features; generation runs the inverted stages right to left.
 *
 * A Cascade is immutable once compiled. Every query keeps its search state to itself, so one instance can serve any
 * number of threads.
 *
 * @param <W> the weight type of the weighting mode
 */
@Immutable
@ThreadSafe
public final class Cascade<W> {

    /**
     * Pass as nbest to keep every result.
     */
    public static final int ALL = Integer.MAX_VALUE;

    private final String name;
    private final Weighting<W> weighting;
    private final List<Transducer<W>> stages;
    private final List<Transducer<W>> generationStages;
    private final Map<String, List<Integer>> subcascades;
    private final Configuration configuration;
    private final Segmenter analysisSegmenter;
    private final Segmenter generationSegmenter;

    Cascade(final String name, final Weighting<W> weighting, final List<Transducer<W>> stages,
            final Map<String, List<Integer>> subcascades, final Configuration configuration) {
        this.name = name;
        this.weighting = weighting;
        this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
        List<Transducer<W>> inverted = new ArrayList<>(stages.size());
        for (int i = stages.size() - 1; i >= 0; i--) {
            inverted.add(stages.get(i).inverted());
        }
        this.generationStages = Collections.unmodifiableList(inverted);
        this.subcascades = Collections.unmodifiableMap(new LinkedHashMap<>(subcascades));
        this.configuration = configuration;
        this.analysisSegmenter = new Segmenter(this.stages.get(0).getInputAlphabet());
        this.generationSegmenter = new Segmenter(this.generationStages.get(0).getInputAlphabet());
    }

    public String getName() {
        return name;
    }

    public Weighting<W> getWeighting() {
        return weighting;
    }

    public List<Transducer<W>> getStages() {
        return stages;
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    public Set<String> getSubcascadeNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(subcascades.keySet()));
    }

    /**
     * The cascade made of the stages a {@code cascade name = {...}} declaration selects, in the declared order.
     *
     * @throws IllegalArgumentException if no subcascade has this name
     */
    public Cascade<W> subcascade(final String subcascadeName) {
        List<Integer> indices = subcascades.get(subcascadeName);
        if (indices == null) {
            throw new IllegalArgumentException("Cascade " + name + " has no subcascade " + subcascadeName);
        }
        List<Transducer<W>> selected = new ArrayList<>(indices.size());
        for (int index : indices) {
            selected.add(stages.get(index));
        }
        return new Cascade<>(subcascadeName, weighting, selected, Collections.emptyMap(), configuration);
    }

    /**
     * View this cascade with its weighting's weight type, so that weights can be passed in and read out.
     *
     * @throws IllegalArgumentException if the cascade was compiled with a different weighting mode
     */
    @SuppressWarnings("unchecked")
    public <X> Cascade<X> withWeighting(final Weighting<X> expected) {
        if (!weighting.equals(expected)) {
            throw new IllegalArgumentException("Cascade " + name + " uses weighting " + weighting.name() +
                    ", not " + expected.name());
        }
        return (Cascade<X>) this;
    }

    /**
     * Split a surface word into the symbols of the first stage's input alphabet.
     */
    public List<String> segment(final String word) {
        return analysisSegmenter.segment(word);
    }

    public List<AnalysisResult> analyze(final String word) {
        return analyze(word, ALL, null);
    }

    public List<AnalysisResult> analyze(final String word, final int nbest) {
        return analyze(word, nbest, null);
    }

    /**
     * Analyze a word.
     *
     * @param word the surface form
     * @param nbest how many results to keep at most, or {@link #ALL}
     * @param frequencies frequencies to rank with, or null
     * @return the analyses, best first; empty if the word cannot be analyzed
     * @throws IllegalArgumentException if nbest is not positive
     */
    public List<AnalysisResult> analyze(final String word, final int nbest,
                                        @Nullable final FrequencySource frequencies) {
        Ranker.checkNbest(nbest);
        List<Candidate<W>> ranked = Ranker.rank(transduce(segment(word), weighting.one()), weighting, frequencies,
                nbest);
        List<AnalysisResult> results = new ArrayList<>(ranked.size());
        for (Candidate<W> candidate : ranked) {
            results.add(AnalysisResult.of(this, candidate));
        }
        return results;
    }

    /**
     * Run the stages left to right over already segmented symbols, without ranking.
     */
    public List<Candidate<W>> transduce(final List<String> symbols, final W initial) {
        return PathFinder.find(new Transduction<>(weighting, stages, null, configuration), symbols, initial);
    }

    public List<String> generate(final String root, final W request) {
        return generate(root, request, ALL);
    }

    /**
     * Generate surface forms of a root that agree with the requested features.
     *
     * @param root the root, as produced by analysis
     * @param request the features every form must be compatible with
     * @param nbest how many forms to keep at most, or {@link #ALL}
     * @return the distinct forms, best first; empty if nothing can be generated
     */
    public List<String> generate(final String root, final W request, final int nbest) {
        Ranker.checkNbest(nbest);
        List<Candidate<W>> ranked = Ranker.rank(generateCandidates(generationSegmenter.segment(root), request),
                weighting, null, ALL);
        List<String> forms = new ArrayList<>();
        for (Candidate<W> candidate : ranked) {
            String form = candidate.form();
            if (!forms.contains(form)) {
                forms.add(form);
                if (forms.size() == nbest) {
                    break;
                }
            }
        }
        return forms;
    }

    /**
     * Run the inverted stages right to left, starting from and constrained by the request, without ranking.
     */
    public List<Candidate<W>> generateCandidates(final List<String> symbols, final W request) {
        return PathFinder.find(new Transduction<>(weighting, generationStages, request, configuration), symbols,
                request);
    }

    @Override
    public String toString() {
        return "Cascade{" + name + ", " + weighting.name() + ", stages=" + stages.size() + "}";
    }
}
