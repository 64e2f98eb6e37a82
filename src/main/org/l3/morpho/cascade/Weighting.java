package org.l3.morpho.cascade;

import org.l3.morpho.cascade.fs.FeatureStructure;

import javax.annotation.Nullable;
import java.util.List;

/**
 * The algebra of transition weights used by one cascade. Weights along a path are combined left to right starting
 * from {@link #one()}; a combination that fails prunes the path.
 *
 * Implementations must be stateless and thread-safe, and their weights immutable with value equality, since
 * weights are used as keys while searching.
 *
 * @param <W> the weight type
 */
public interface Weighting<W> {

    /**
     * The mode name used in {@code weighting = NAME} declarations. Matched case-insensitively.
     */
    String name();

    /**
     * The weight that leaves any weight unchanged when combined with it.
     */
    W one();

    /**
     * Parse the weight written after a rule's labels. Text may denote several alternatives, each of which gives a
     * parallel transition.
     *
     * @param text the bracketed weight text
     * @return the alternatives, never empty
     * @throws IllegalArgumentException if the text is malformed
     */
    List<W> parse(String text);

    /**
     * Combine two weights.
     *
     * @return the combination, or null if the weights are incompatible
     */
    @Nullable
    W combine(W left, W right);

    /**
     * The ranking score of a complete result, higher is better.
     *
     * @param weight the result's weight
     * @param form the result's symbols joined
     * @param frequencies frequencies to score with, or null
     */
    double score(W weight, String form, @Nullable FrequencySource frequencies);

    /**
     * Order two weights whose scores tie. Negative when left should rank ahead of right.
     */
    int compare(W left, W right);

    /**
     * The grammatical features carried by a weight, for result extraction.
     */
    FeatureStructure features(W weight);
}
