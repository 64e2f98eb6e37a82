package org.l3.morpho.cascade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/*
 * Notes on the implementation:
 *
 * A string is fed to the first stage; each output of a stage is handed to the next stage as soon as it is found, and
 *  outputs of the last stage are the candidates. Within a stage, the search runs depth-first from the start state
 *  over the arcs of each state. Arcs already fold in transitions that read no input, so every arc moves one position
 *  and the search never meets a Step twice on one path.
 *
 * The (output suffix, weight) pairs leading from a Step to acceptance do not depend on how the Step was reached, so
 *  they are memoized per Step once its search completes, and replayed for every later path through it.
 *
 * The budget is charged for each string fed to a stage, each Step searched, and each suffix produced. Once it is used
 *  up nothing more is produced, but everything produced before reaches the later stages, so a cut-short search still
 *  returns the candidates it finished.
 */

/**
 * Runs the stages of a Cascade over a string and collects complete candidates.
 */
@ThreadSafe
final class PathFinder {

    private static final Logger log = LoggerFactory.getLogger(PathFinder.class);

    private PathFinder() { }

    /**
     * Feed the symbols to the first stage of the transduction and return every candidate leaving the last stage.
     *
     * @param task the transduction, holding the stages and the search state
     * @param symbols the input
     * @param initial the weight the search starts from
     * @return the candidates in the order found; may be empty but never null
     */
    static <W> List<Candidate<W>> find(final Transduction<W> task, final List<String> symbols, final W initial) {
        if (task.admits(initial)) {
            feed(task, 0, Collections.unmodifiableList(new ArrayList<>(symbols)), initial);
        }
        if (task.isExhausted()) {
            log.warn("Search budget used up after {} steps for {}; returning {} partial results",
                    task.getSteps(), String.join("", symbols), task.getCandidates().size());
        }
        return task.getCandidates();
    }

    private static <W> void feed(final Transduction<W> task, final int stage, final List<String> input,
                                 final W weight) {
        if (stage == task.stages.size()) {
            task.addCandidate(input, weight);
            return;
        }
        if (!task.markFed(stage, input, weight) || !task.spend()) {
            return;
        }
        Transducer<W> transducer = task.stages.get(stage);
        Step start = new Step(stage, task.inputId(stage, input), transducer.getStartState().getIndex(), 0);
        explore(task, transducer, start, input, suffix -> {
            W combined = task.weighting.combine(weight, suffix.weight);
            if (combined != null && task.admits(combined)) {
                feed(task, stage + 1, suffix.symbols, combined);
            }
        });
    }

    private static <W> void explore(final Transduction<W> task, final Transducer<W> transducer, final Step step,
                                    final List<String> input, final Consumer<Suffix<W>> sink) {
        List<Suffix<W>> known = task.recalled(step);
        if (known != null) {
            for (Suffix<W> suffix : known) {
                if (!task.spend()) {
                    return;
                }
                sink.accept(suffix);
            }
            return;
        }
        if (!task.spend()) {
            return;
        }

        Set<Suffix<W>> found = new LinkedHashSet<>();
        Consumer<Suffix<W>> collect = suffix -> {
            if (task.spend() && found.add(suffix)) {
                sink.accept(suffix);
            }
        };
        State<W> state = transducer.getState(step.state);
        if (step.position == input.size()) {
            for (Arc<W> ending : state.getEndings()) {
                if (task.admits(ending.weight)) {
                    collect.accept(new Suffix<>(ending.outputs, ending.weight));
                }
            }
        } else {
            for (Arc<W> arc : state.getArcsOn(input.get(step.position))) {
                if (task.isExhausted()) {
                    break;
                }
                Step next = new Step(step.stage, step.inputId, arc.target, step.position + 1);
                explore(task, transducer, next, input, suffix -> {
                    W combined = task.weighting.combine(arc.weight, suffix.weight);
                    if (combined != null && task.admits(combined)) {
                        collect.accept(suffix.prepend(arc.outputs, combined));
                    }
                });
            }
        }

        if (!task.isExhausted()) {
            task.remember(step, Collections.unmodifiableList(new ArrayList<>(found)));
        }
    }
}
