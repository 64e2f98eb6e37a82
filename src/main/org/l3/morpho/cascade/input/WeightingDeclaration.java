package org.l3.morpho.cascade.input;

/**
 * {@code weighting = MODE} in a cascade file.
 */
public final class WeightingDeclaration extends GrammarItem {

    private final String mode;

    WeightingDeclaration(final int line, final String mode) {
        super(line);
        this.mode = mode;
    }

    public String getMode() {
        return mode;
    }
}
