package org.l3.morpho.cascade;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A compiled weighted finite-state transducer, one stage of a Cascade. States are numbered from 0 and transitions
 * refer to them by number.
 *
 * Transitions that read no input are folded into the arcs of each state when the transducer is built. Only paths
 * that visit no state twice are folded in, so a loop of such transitions is never taken.
 *
 * @param <W> the weight type
 */
@Immutable
public final class Transducer<W> {

    private final String name;
    private final Weighting<W> weighting;
    private final List<State<W>> states;
    private final int start;
    private final Set<String> inputAlphabet;
    private final Set<String> outputAlphabet;

    Transducer(final String name, final Weighting<W> weighting, final List<String> stateNames,
               final Set<Integer> finals, final List<? extends Collection<Transition<W>>> transitions,
               final int start) {
        this.name = name;
        this.weighting = weighting;
        this.start = start;

        List<State<W>> built = new ArrayList<>(stateNames.size());
        Set<String> in = new LinkedHashSet<>();
        Set<String> out = new LinkedHashSet<>();
        for (int i = 0; i < stateNames.size(); i++) {
            Map<String, Set<Arc<W>>> arcs = new LinkedHashMap<>();
            Set<Arc<W>> endings = new LinkedHashSet<>();
            for (Arc<W> path : closure(i, transitions)) {
                if (finals.contains(path.target)) {
                    endings.add(path);
                }
                for (Transition<W> transition : transitions.get(path.target)) {
                    if (transition.input != null) {
                        Arc<W> arc = path.then(transition, weighting);
                        if (arc != null) {
                            arcs.computeIfAbsent(transition.input, k -> new LinkedHashSet<>()).add(arc);
                        }
                    }
                }
            }
            for (Transition<W> transition : transitions.get(i)) {
                if (transition.input != null) {
                    in.add(transition.input);
                }
                if (transition.output != null) {
                    out.add(transition.output);
                }
            }
            built.add(new State<>(i, stateNames.get(i), finals.contains(i), transitions.get(i), freeze(arcs),
                    Collections.unmodifiableList(new ArrayList<>(endings))));
        }
        this.states = Collections.unmodifiableList(built);
        this.inputAlphabet = Collections.unmodifiableSet(in);
        this.outputAlphabet = Collections.unmodifiableSet(out);
    }

    /**
     * The paths from origin through transitions reading no input, the empty path first.
     */
    private List<Arc<W>> closure(final int origin, final List<? extends Collection<Transition<W>>> transitions) {
        Set<Arc<W>> paths = new LinkedHashSet<>();
        walk(new Arc<>(Collections.emptyList(), weighting.one(), origin), new HashSet<>(), transitions, paths);
        return new ArrayList<>(paths);
    }

    private void walk(final Arc<W> path, final Set<Integer> visited,
                      final List<? extends Collection<Transition<W>>> transitions, final Set<Arc<W>> paths) {
        paths.add(path);
        visited.add(path.target);
        for (Transition<W> transition : transitions.get(path.target)) {
            if (transition.input == null && !visited.contains(transition.target)) {
                Arc<W> longer = path.then(transition, weighting);
                if (longer != null) {
                    walk(longer, visited, transitions, paths);
                }
            }
        }
        visited.remove(path.target);
    }

    private static <W> Map<String, List<Arc<W>>> freeze(final Map<String, Set<Arc<W>>> arcs) {
        Map<String, List<Arc<W>>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, Set<Arc<W>>> entry : arcs.entrySet()) {
            frozen.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(frozen);
    }

    public String getName() {
        return name;
    }

    public int getStateCount() {
        return states.size();
    }

    public int getTransitionCount() {
        int count = 0;
        for (State<W> state : states) {
            count += state.getTransitions().size();
        }
        return count;
    }

    public Set<String> getInputAlphabet() {
        return inputAlphabet;
    }

    public Set<String> getOutputAlphabet() {
        return outputAlphabet;
    }

    State<W> getStartState() {
        return states.get(start);
    }

    State<W> getState(final int index) {
        return states.get(index);
    }

    /**
     * Whether some path from the start state reads exactly these symbols, ignoring outputs and weights.
     */
    public boolean accepts(final List<String> symbols) {
        Set<Integer> current = Collections.singleton(start);
        for (String symbol : symbols) {
            Set<Integer> next = new LinkedHashSet<>();
            for (int index : current) {
                for (Arc<W> arc : states.get(index).getArcsOn(symbol)) {
                    next.add(arc.target);
                }
            }
            if (next.isEmpty()) {
                return false;
            }
            current = next;
        }
        for (int index : current) {
            if (!states.get(index).getEndings().isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * The same transducer with input and output swapped on every transition, used for generation.
     */
    public Transducer<W> inverted() {
        List<String> names = new ArrayList<>(states.size());
        Set<Integer> finals = new HashSet<>();
        List<List<Transition<W>>> swapped = new ArrayList<>(states.size());
        for (State<W> state : states) {
            names.add(state.getName());
            if (state.isFinal()) {
                finals.add(state.getIndex());
            }
            List<Transition<W>> reversed = new ArrayList<>();
            for (Transition<W> transition : state.getTransitions()) {
                reversed.add(transition.inverted());
            }
            swapped.add(reversed);
        }
        return new Transducer<>(name, weighting, names, finals, swapped, start);
    }

    @Override
    public String toString() {
        return "Transducer{" + name + ", states=" + states.size() + ", start=" + states.get(start) + "}";
    }
}
