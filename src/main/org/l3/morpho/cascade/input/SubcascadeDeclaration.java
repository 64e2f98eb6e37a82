package org.l3.morpho.cascade.input;

import java.util.Collections;
import java.util.List;

/**
 * {@code cascade name = {0, 2, 3}}: a named selection of stage indices.
 */
public final class SubcascadeDeclaration extends GrammarItem {

    private final String name;
    private final List<Integer> indices;

    SubcascadeDeclaration(final int line, final String name, final List<Integer> indices) {
        super(line);
        this.name = name;
        this.indices = Collections.unmodifiableList(indices);
    }

    public String getName() {
        return name;
    }

    public List<Integer> getIndices() {
        return indices;
    }
}
