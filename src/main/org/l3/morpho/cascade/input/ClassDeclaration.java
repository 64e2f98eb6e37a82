package org.l3.morpho.cascade.input;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.Collections;
import java.util.List;

/**
 * {@code Name = {a, b, c}} or {@code Name = Base - {a, b}}.
 */
@Immutable
public final class ClassDeclaration extends GrammarItem {

    private final String name;
    private final String base;
    private final List<String> members;

    ClassDeclaration(final int line, final String name, @Nullable final String base, final List<String> members) {
        super(line);
        this.name = name;
        this.base = base;
        this.members = Collections.unmodifiableList(members);
    }

    public String getName() {
        return name;
    }

    /**
     * The class being subtracted from, or null for an enumerated class.
     */
    @Nullable
    public String getBase() {
        return base;
    }

    /**
     * The enumerated members, or the symbols subtracted from the base.
     */
    public List<String> getMembers() {
        return members;
    }

    public boolean isSubtraction() {
        return base != null;
    }
}
