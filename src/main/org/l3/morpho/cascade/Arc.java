package org.l3.morpho.cascade;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A path of transitions folded into one move: any number of transitions that read no input, then at most one that
 * reads a symbol. The outputs and weights along the path are concatenated and combined.
 */
@Immutable
final class Arc<W> {
    final List<String> outputs;
    final W weight;
    final int target;

    Arc(final List<String> outputs, final W weight, final int target) {
        this.outputs = outputs.isEmpty() ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(outputs));
        this.weight = weight;
        this.target = target;
    }

    /**
     * This path followed by one more transition, or null if the weights do not combine.
     */
    @Nullable
    Arc<W> then(final Transition<W> transition, final Weighting<W> weighting) {
        W combined = weighting.combine(weight, transition.weight);
        if (combined == null) {
            return null;
        }
        if (transition.output == null) {
            return new Arc<>(outputs, combined, transition.target);
        }
        List<String> longer = new ArrayList<>(outputs.size() + 1);
        longer.addAll(outputs);
        longer.add(transition.output);
        return new Arc<>(longer, combined, transition.target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Arc<?> arc = (Arc<?>) o;
        return target == arc.target && outputs.equals(arc.outputs) && weight.equals(arc.weight);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outputs, weight, target);
    }

    @Override
    public String toString() {
        return "-> " + target + " " + outputs + " " + weight;
    }
}
