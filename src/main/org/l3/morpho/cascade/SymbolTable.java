package org.l3.morpho.cascade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Symbol classes visible while compiling one file. A rule file's table has the cascade's table as parent, so
 * cascade-level classes are visible in every stage and a stage may shadow them.
 *
 * Subtractions are materialized when declared: redefining the base afterwards does not change them.
 */
class SymbolTable {

    private static final Logger log = LoggerFactory.getLogger(SymbolTable.class);

    private final SymbolTable parent;
    private final Map<String, StringSet> classes = new HashMap<>();

    SymbolTable() {
        this(null);
    }

    SymbolTable(@Nullable final SymbolTable parent) {
        this.parent = parent;
    }

    void define(final String name, final Collection<String> members) {
        put(new StringSet(name, members));
    }

    /**
     * Define name as the members of base minus removed. Removed names that are classes remove all their members.
     *
     * @throws UndefinedClassException if base is not visible
     */
    void defineDifference(final String source, final int line, final String name, final String base,
                          final Collection<String> removed) throws UndefinedClassException {
        StringSet baseSet = lookup(base);
        if (baseSet == null) {
            throw new UndefinedClassException(source, line, base);
        }
        put(baseSet.minus(name, expand(removed)));
    }

    private void put(final StringSet set) {
        if (classes.put(set.getName(), set) != null) {
            log.debug("Class {} redefined", set.getName());
        }
    }

    /**
     * The class with this name, searching enclosing scopes, or null if it is not a class.
     */
    @Nullable
    StringSet lookup(final String name) {
        StringSet set = classes.get(name);
        if (set == null && parent != null) {
            return parent.lookup(name);
        }
        return set;
    }

    boolean isClass(final String name) {
        return lookup(name) != null;
    }

    /**
     * Every member of every visible class.
     */
    Set<String> members() {
        Set<String> all = parent == null ? new HashSet<>() : parent.members();
        for (StringSet set : classes.values()) {
            all.addAll(set.getMembers());
        }
        return all;
    }

    /**
     * Replace each class name by its members, keeping other symbols as they are.
     */
    List<String> expand(final Collection<String> names) {
        List<String> result = new ArrayList<>();
        for (String name : names) {
            StringSet set = lookup(name);
            if (set == null) {
                result.add(name);
            } else {
                result.addAll(set.getMembers());
            }
        }
        return result;
    }
}
