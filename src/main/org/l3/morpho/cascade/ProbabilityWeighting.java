package org.l3.morpho.cascade;

import org.l3.morpho.cascade.fs.FeatureStructure;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;

/**
 * Weights are probabilities multiplied along a path. A zero product prunes the path; more probable results rank
 * first.
 */
@ThreadSafe
public final class ProbabilityWeighting implements Weighting<Double> {

    public static final String NAME = "PROBABILITY";

    public static final ProbabilityWeighting INSTANCE = new ProbabilityWeighting();

    private ProbabilityWeighting() { }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Double one() {
        return 1.0;
    }

    @Override
    public List<Double> parse(final String text) {
        List<Double> result = new ArrayList<>();
        for (String number : NumericWeights.split(text)) {
            double p = NumericWeights.parseNumber(text, number);
            if (p < 0) {
                throw new IllegalArgumentException("Negative probability " + number + " in " + text);
            }
            result.add(p);
        }
        if (result.isEmpty()) {
            result.add(one());
        }
        return result;
    }

    @Override
    @Nullable
    public Double combine(final Double left, final Double right) {
        double product = left * right;
        return product == 0 ? null : product;
    }

    @Override
    public double score(final Double weight, final String form, @Nullable final FrequencySource frequencies) {
        return weight;
    }

    @Override
    public int compare(final Double left, final Double right) {
        return Double.compare(right, left);
    }

    @Override
    public FeatureStructure features(final Double weight) {
        return FeatureStructure.EMPTY;
    }

    @Override
    public String toString() {
        return NAME;
    }
}
