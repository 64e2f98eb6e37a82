package org.l3.morpho.cascade.input;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A path line of a morphotactic file: the input string that leads from one {@code $} state to the next.
 *
 * The input is a class name, {@code --} for no input, or a string of symbols. Paths indented under a feature line
 * also carry that line's features.
 */
@Immutable
public final class PathRule extends GrammarItem {

    public static final String NO_INPUT = "--";

    private final String source;
    private final String target;
    private final String input;
    private final String weight;
    private final String inherited;

    PathRule(final int line, final String source, final String target, final String input,
             @Nullable final String weight, @Nullable final String inherited) {
        super(line);
        this.source = source;
        this.target = target;
        this.input = input;
        this.weight = weight;
        this.inherited = inherited;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public String getInput() {
        return input;
    }

    public boolean readsNothing() {
        return NO_INPUT.equals(input);
    }

    @Nullable
    public String getWeight() {
        return weight;
    }

    /**
     * The features of the enclosing feature line, or null if the path is not indented under one.
     */
    @Nullable
    public String getInherited() {
        return inherited;
    }
}
