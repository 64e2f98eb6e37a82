package org.l3.morpho.cascade.input;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.Collections;
import java.util.List;

/**
 * {@code S -> T [labels] [weight]}, or {@code S ->} which marks S final.
 *
 * An empty label list stands for a single epsilon:epsilon label.
 */
@Immutable
public final class TransitionRule extends GrammarItem {

    private final String source;
    private final String target;
    private final List<LabelSpec> labels;
    private final String weight;

    TransitionRule(final int line, final String source, @Nullable final String target, final List<LabelSpec> labels,
                   @Nullable final String weight) {
        super(line);
        this.source = source;
        this.target = target;
        this.labels = Collections.unmodifiableList(labels);
        this.weight = weight;
    }

    public String getSource() {
        return source;
    }

    /**
     * The target state, or null if this rule only marks its source as final.
     */
    @Nullable
    public String getTarget() {
        return target;
    }

    public boolean isFinalMarker() {
        return target == null;
    }

    public List<LabelSpec> getLabels() {
        return labels;
    }

    /**
     * The weight text without interpretation, or null if the rule carries none.
     */
    @Nullable
    public String getWeight() {
        return weight;
    }
}
