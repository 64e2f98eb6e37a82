package org.l3.morpho.cascade;

import org.l3.morpho.cascade.fs.FeatureStructure;

/**
 * Corpus frequencies used to rank analyses. Frequencies are estimated elsewhere; this only looks them up.
 */
public interface FrequencySource {

    /**
     * How often the root occurs with these features, 0 if unknown.
     */
    double rootFrequency(String root, FeatureStructure features);

    /**
     * The relative frequency of the grammatical features, 1 if nothing is known about them.
     */
    double featureFrequency(FeatureStructure features);
}
