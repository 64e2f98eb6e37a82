package org.l3.morpho.cascade.input;

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * One alternative of a bracketed label list: {@code in:out}, or a single pattern that maps to itself.
 */
@Immutable
public final class LabelSpec {

    private final LabelPattern input;
    private final LabelPattern output;
    private final boolean identity;

    LabelSpec(final LabelPattern input, final LabelPattern output, final boolean identity) {
        this.input = input;
        this.output = output;
        this.identity = identity;
    }

    static LabelSpec identity(final LabelPattern pattern) {
        return new LabelSpec(pattern, pattern, true);
    }

    static LabelSpec pair(final LabelPattern input, final LabelPattern output) {
        return new LabelSpec(input, output, false);
    }

    public LabelPattern getInput() {
        return input;
    }

    public LabelPattern getOutput() {
        return output;
    }

    /**
     * True when written without a colon, so every symbol the pattern denotes maps to itself.
     */
    public boolean isIdentity() {
        return identity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LabelSpec that = (LabelSpec) o;
        return identity == that.identity && input.equals(that.input) && output.equals(that.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, output, identity);
    }

    @Override
    public String toString() {
        return identity ? input.toString() : input + ":" + output;
    }
}
