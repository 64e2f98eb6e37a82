package org.l3.morpho.cascade;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A named symbol class. Members keep their declaration order, which positional {@code X:Y} labels rely on.
 */
@Immutable
public final class StringSet implements Iterable<String> {

    private final String name;
    private final List<String> members;
    private final Set<String> lookup;

    StringSet(final String name, final Collection<String> members) {
        this.name = name;
        this.lookup = Collections.unmodifiableSet(new LinkedHashSet<>(members));
        this.members = Collections.unmodifiableList(new ArrayList<>(lookup));
    }

    public String getName() {
        return name;
    }

    public List<String> getMembers() {
        return members;
    }

    public boolean contains(final String symbol) {
        return lookup.contains(symbol);
    }

    public int size() {
        return members.size();
    }

    /**
     * The members of this class that are not in removed, in order.
     */
    StringSet minus(final String newName, final Collection<String> removed) {
        List<String> remaining = new ArrayList<>(members);
        remaining.removeAll(removed);
        return new StringSet(newName, remaining);
    }

    @Override
    public Iterator<String> iterator() {
        return members.iterator();
    }

    @Override
    public String toString() {
        return name + members;
    }
}
