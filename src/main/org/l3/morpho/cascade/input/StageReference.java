package org.l3.morpho.cascade.input;

/**
 * {@code >name<} in a cascade file: the next stage of the cascade.
 */
public final class StageReference extends GrammarItem {

    private final String name;

    StageReference(final int line, final String name) {
        super(line);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
