package org.l3.morpho.cascade;

import org.l3.morpho.cascade.fs.FeatureStructure;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;

/**
 * Weights are costs added along a path; cheaper results rank first. Nothing is pruned.
 */
@ThreadSafe
public final class TropicalWeighting implements Weighting<Double> {

    public static final String NAME = "TROPICAL";

    public static final TropicalWeighting INSTANCE = new TropicalWeighting();

    private TropicalWeighting() { }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Double one() {
        return 0.0;
    }

    @Override
    public List<Double> parse(final String text) {
        List<Double> result = new ArrayList<>();
        for (String number : NumericWeights.split(text)) {
            result.add(NumericWeights.parseNumber(text, number));
        }
        if (result.isEmpty()) {
            result.add(one());
        }
        return result;
    }

    @Override
    public Double combine(final Double left, final Double right) {
        return left + right;
    }

    @Override
    public double score(final Double weight, final String form, @Nullable final FrequencySource frequencies) {
        return -weight;
    }

    @Override
    public int compare(final Double left, final Double right) {
        return Double.compare(left, right);
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
