package org.l3.morpho.cascade;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Represents a point in the search: a state of one stage, reading one of that stage's input strings at a
 * position. Every visit to the same Step yields the same suffixes, which is what makes memoizing on it safe.
 */
@Immutable
@ThreadSafe
final class Step {
    final int stage;
    final int inputId;
    final int state;
    final int position;

    Step(final int stage, final int inputId, final int state, final int position) {
        this.stage = stage;
        this.inputId = inputId;
        this.state = state;
        this.position = position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Step step = (Step) o;
        return stage == step.stage &&
                inputId == step.inputId &&
                state == step.state &&
                position == step.position;
    }

    @Override
    public int hashCode() {
        int result = stage;
        result = 31 * result + inputId;
        result = 31 * result + state;
        result = 31 * result + position;
        return result;
    }

    @Override
    public String toString() {
        return "Step{stage=" + stage + ", input=" + inputId + ", state=" + state + ", position=" + position + "}";
    }
}
