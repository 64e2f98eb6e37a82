package org.l3.morpho.cascade;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A state of a Transducer. Besides its own transitions, a state holds the moves the search makes from it: the arcs
 * reading each input symbol and the ways to stop here. Both already include every path through transitions that
 * read no input, so the search never follows those itself.
 */
@Immutable
final class State<W> {

    private final int index;
    private final String name;
    private final boolean accepting;
    private final List<Transition<W>> transitions;
    private final Map<String, List<Arc<W>>> arcs;
    private final List<Arc<W>> endings;

    State(final int index, final String name, final boolean accepting, final Collection<Transition<W>> transitions,
          final Map<String, List<Arc<W>>> arcs, final List<Arc<W>> endings) {
        this.index = index;
        this.name = name;
        this.accepting = accepting;
        this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
        this.arcs = arcs;
        this.endings = endings;
    }

    int getIndex() {
        return index;
    }

    String getName() {
        return name;
    }

    boolean isFinal() {
        return accepting;
    }

    /**
     * The transitions leaving this state as written in the rule file.
     */
    List<Transition<W>> getTransitions() {
        return transitions;
    }

    /**
     * Moves that read this symbol, possibly after transitions that read nothing.
     */
    List<Arc<W>> getArcsOn(final String symbol) {
        List<Arc<W>> found = arcs.get(symbol);
        return found == null ? Collections.emptyList() : found;
    }

    /**
     * Paths reading nothing that end in a final state, including the empty path if this state is final.
     */
    List<Arc<W>> getEndings() {
        return endings;
    }

    @Override
    public String toString() {
        return name + (accepting ? "(final)" : "");
    }
}
