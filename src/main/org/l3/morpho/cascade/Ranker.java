package org.l3.morpho.cascade;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders candidates best first and keeps the n best. Ties in score are broken by the weighting, then by the
 * printed form and weight, so the order never depends on search order.
 */
final class Ranker {

    private Ranker() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    static void checkNbest(final int nbest) {
        if (nbest <= 0) {
            throw new IllegalArgumentException("nbest must be positive but was " + nbest);
        }
    }

    static <W> List<Candidate<W>> rank(final List<Candidate<W>> candidates, final Weighting<W> weighting,
                                       @Nullable final FrequencySource frequencies, final int nbest) {
        checkNbest(nbest);
        List<Candidate<W>> scored = new ArrayList<>(candidates.size());
        for (Candidate<W> candidate : candidates) {
            scored.add(candidate.withScore(weighting.score(candidate.getWeight(), candidate.form(), frequencies)));
        }
        Comparator<Candidate<W>> order = Comparator.<Candidate<W>>comparingDouble(Candidate::getScore).reversed()
                .thenComparing((a, b) -> weighting.compare(a.getWeight(), b.getWeight()))
                .thenComparing(Candidate::form)
                .thenComparing(c -> String.valueOf(c.getWeight()));
        scored.sort(order);
        return scored.size() > nbest ? new ArrayList<>(scored.subList(0, nbest)) : scored;
    }
}
