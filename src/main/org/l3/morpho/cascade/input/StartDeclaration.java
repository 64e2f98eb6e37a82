package org.l3.morpho.cascade.input;

/**
 * {@code -> state}: names the start state explicitly.
 */
public final class StartDeclaration extends GrammarItem {

    private final String state;

    StartDeclaration(final int line, final String state) {
        super(line);
        this.state = state;
    }

    public String getState() {
        return state;
    }
}
