package org.l3.morpho.cascade;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * An arc between two states, identified by their indexes. A null input or output symbol is epsilon.
 */
@Immutable
final class Transition<W> {
    final int source;
    final int target;
    final String input;
    final String output;
    final W weight;

    Transition(final int source, final int target, @Nullable final String input, @Nullable final String output,
               final W weight) {
        this.source = source;
        this.target = target;
        this.input = input;
        this.output = output;
        this.weight = weight;
    }

    Transition<W> inverted() {
        return new Transition<>(source, target, output, input, weight);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition<?> that = (Transition<?>) o;
        return source == that.source &&
                target == that.target &&
                Objects.equals(input, that.input) &&
                Objects.equals(output, that.output) &&
                weight.equals(that.weight);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, input, output, weight);
    }

    @Override
    public String toString() {
        return source + " -> " + target + " [" + (input == null ? "" : input) + ":" +
                (output == null ? "" : output) + "] " + weight;
    }
}
