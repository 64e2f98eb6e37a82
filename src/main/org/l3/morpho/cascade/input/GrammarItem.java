package org.l3.morpho.cascade.input;

/**
 * One meaningful line of a rule or cascade file. Items keep their line number so that the build pass can report
 * problems with their source location.
 */
public abstract class GrammarItem {

    private final int line;

    GrammarItem(final int line) {
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
