package org.l3.morpho.cascade;

import org.l3.morpho.cascade.fs.FeatureStructure;
import org.l3.morpho.cascade.fs.FeatureStructureParseException;
import org.l3.morpho.cascade.fs.FeatureStructureParser;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

/**
 * Weights are feature structures; combining is unification and a unification failure prunes the path.
 */
@ThreadSafe
public final class UnificationWeighting implements Weighting<FeatureStructure> {

    public static final String NAME = "UNIFICATION";

    public static final UnificationWeighting INSTANCE = new UnificationWeighting();

    private UnificationWeighting() { }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FeatureStructure one() {
        return FeatureStructure.EMPTY;
    }

    @Override
    public List<FeatureStructure> parse(final String text) {
        try {
            return FeatureStructureParser.parseAlternatives(text);
        } catch (FeatureStructureParseException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    @Override
    @Nullable
    public FeatureStructure combine(final FeatureStructure left, final FeatureStructure right) {
        return left.unify(right);
    }

    /**
     * The root's count for these features times the relative frequency of the features, or 0 without frequencies.
     */
    @Override
    public double score(final FeatureStructure weight, final String form,
                        @Nullable final FrequencySource frequencies) {
        if (frequencies == null) {
            return 0;
        }
        return frequencies.rootFrequency(form, weight) * frequencies.featureFrequency(weight);
    }

    // more specified analyses first
    @Override
    public int compare(final FeatureStructure left, final FeatureStructure right) {
        return Integer.compare(right.specificity(), left.specificity());
    }

    @Override
    public FeatureStructure features(final FeatureStructure weight) {
        return weight;
    }

    @Override
    public String toString() {
        return NAME;
    }
}
