package org.l3.morpho.cascade;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Represents the state of one analysis or generation: the memo of explored Steps, the search budget, and the
 * candidates found so far. Each query gets its own Transduction, so compiled cascades can be shared by threads.
 */
final class Transduction<W> {

    private static final int CLOCK_INTERVAL = 256;

    final Weighting<W> weighting;
    final List<Transducer<W>> stages;

    // every partial path must stay compatible with this, if set
    final W constraint;

    // suffixes reachable from each Step; only searches the budget did not cut short are stored
    private final Map<Step, List<Suffix<W>>> memo = new HashMap<>();

    // intermediate strings are numbered per stage so that Steps stay small
    private final List<Map<List<String>, Integer>> inputIds = new ArrayList<>();

    // (string, weight) pairs already fed to each stage
    private final List<Set<Candidate<W>>> fed = new ArrayList<>();

    private final Set<Candidate<W>> candidates = new LinkedHashSet<>();

    private final long maxSteps;
    private final long deadline;
    private final boolean timed;
    private long steps = 0;
    private boolean exhausted = false;

    Transduction(final Weighting<W> weighting, final List<Transducer<W>> stages, @Nullable final W constraint,
                 final Configuration configuration) {
        this.weighting = weighting;
        this.stages = stages;
        this.constraint = constraint;
        this.maxSteps = configuration.getMaxSteps();
        Duration timeout = configuration.getTimeout();
        this.timed = timeout != null;
        this.deadline = timed ? System.nanoTime() + timeout.toNanos() : 0;
        for (int i = 0; i < stages.size(); i++) {
            inputIds.add(new HashMap<>());
            fed.add(new HashSet<>());
        }
    }

    int inputId(final int stage, final List<String> input) {
        Map<List<String>, Integer> ids = inputIds.get(stage);
        Integer id = ids.get(input);
        if (id == null) {
            id = ids.size();
            ids.put(input, id);
        }
        return id;
    }

    boolean markFed(final int stage, final List<String> input, final W weight) {
        return fed.get(stage).add(new Candidate<>(input, weight));
    }

    @Nullable
    List<Suffix<W>> recalled(final Step step) {
        return memo.get(step);
    }

    void remember(final Step step, final List<Suffix<W>> suffixes) {
        memo.put(step, suffixes);
    }

    /**
     * Charge one step to the budget.
     *
     * @return false once the budget is used up
     */
    boolean spend() {
        if (exhausted) {
            return false;
        }
        steps++;
        if (steps > maxSteps || (timed && steps % CLOCK_INTERVAL == 0 && System.nanoTime() - deadline > 0)) {
            exhausted = true;
        }
        return !exhausted;
    }

    boolean isExhausted() {
        return exhausted;
    }

    long getSteps() {
        return steps;
    }

    /**
     * @return true if the path weight survives the constraint
     */
    boolean admits(final W weight) {
        return constraint == null || weighting.combine(constraint, weight) != null;
    }

    void addCandidate(final List<String> symbols, final W weight) {
        candidates.add(new Candidate<>(symbols, weight));
    }

    List<Candidate<W>> getCandidates() {
        return new ArrayList<>(candidates);
    }
}
