package org.l3.morpho.cascade.fs;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A partial mapping from attribute names to FeatureValues. Attributes that are not present are unconstrained, so
 * the empty structure unifies with everything.
 *
 * Instances are immutable. Attributes are kept sorted by name, which makes equality, hashing and the printed form
 * independent of the order in which attributes were added.
 */
@Immutable
@ThreadSafe
public final class FeatureStructure implements FeatureValue {

    /**
     * The structure with no attributes; the identity element of unification.
     */
    public static final FeatureStructure EMPTY = new FeatureStructure(Collections.emptySortedMap());

    private final SortedMap<String, FeatureValue> features;

    private FeatureStructure(final SortedMap<String, FeatureValue> features) {
        this.features = features;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse a single feature structure, e.g. {@code [+def,num=pl,poss=[p=1]]}.
     *
     * @param text the structure as text
     * @return the structure
     * @throws FeatureStructureParseException if the text is malformed or denotes more than one alternative
     */
    public static FeatureStructure parse(final String text) {
        List<FeatureStructure> alternatives = FeatureStructureParser.parseAlternatives(text);
        if (alternatives.size() != 1) {
            throw new FeatureStructureParseException("Expected a single feature structure but found " +
                    alternatives.size() + " alternatives in " + text);
        }
        return alternatives.get(0);
    }

    @Nullable
    public FeatureValue get(final String name) {
        return features.get(name);
    }

    /**
     * Look up a value by a dot-separated path such as {@code poss.p}.
     */
    @Nullable
    public FeatureValue getPath(final String path) {
        FeatureStructure current = this;
        String[] steps = path.split("\\.");
        for (int i = 0; i < steps.length - 1; i++) {
            FeatureValue next = current.get(steps[i]);
            if (!(next instanceof FeatureStructure)) {
                return null;
            }
            current = (FeatureStructure) next;
        }
        return current.get(steps[steps.length - 1]);
    }

    /**
     * The atom stored under name, or null if the attribute is absent or not an atom.
     */
    @Nullable
    public String getAtom(final String name) {
        FeatureValue value = features.get(name);
        return value instanceof AtomValue ? ((AtomValue) value).getValue() : null;
    }

    public boolean contains(final String name) {
        return features.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(features.keySet());
    }

    public int size() {
        return features.size();
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    /**
     * Unify two structures: attributes present in only one operand are copied, attributes present in both are unified
     * recursively.
     *
     * @param other the structure to unify with
     * @return the most general structure consistent with both, or null if any shared attribute is incompatible
     */
    @Nullable
    public FeatureStructure unify(final FeatureStructure other) {
        if (other == this || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        SortedMap<String, FeatureValue> merged = new TreeMap<>(features);
        for (Map.Entry<String, FeatureValue> entry : other.features.entrySet()) {
            FeatureValue mine = merged.get(entry.getKey());
            if (mine == null) {
                merged.put(entry.getKey(), entry.getValue());
            } else {
                FeatureValue unified = mine.unify(entry.getValue());
                if (unified == null) {
                    return null;
                }
                merged.put(entry.getKey(), unified);
            }
        }
        return new FeatureStructure(Collections.unmodifiableSortedMap(merged));
    }

    @Override
    @Nullable
    public FeatureValue unify(final FeatureValue other) {
        return other instanceof FeatureStructure ? unify((FeatureStructure) other) : null;
    }

    public boolean unifiesWith(final FeatureStructure other) {
        return unify(other) != null;
    }

    /**
     * A copy of this structure with the named top-level attribute removed.
     */
    public FeatureStructure without(final String name) {
        if (!features.containsKey(name)) {
            return this;
        }
        SortedMap<String, FeatureValue> copy = new TreeMap<>(features);
        copy.remove(name);
        return copy.isEmpty() ? EMPTY : new FeatureStructure(Collections.unmodifiableSortedMap(copy));
    }

    @Override
    public int specificity() {
        int total = 0;
        for (FeatureValue value : features.values()) {
            total += value.specificity();
        }
        return total;
    }

    /**
     * Flatten into attribute strings: {@code +f}, {@code -f}, {@code a=v} and {@code a.b=v} for nested values.
     */
    public List<String> attributes() {
        List<String> result = new ArrayList<>();
        flatten("", result);
        return result;
    }

    private void flatten(final String prefix, final List<String> out) {
        for (Map.Entry<String, FeatureValue> entry : features.entrySet()) {
            String name = prefix + entry.getKey();
            FeatureValue value = entry.getValue();
            if (value instanceof FlagValue) {
                out.add(value + name);
            } else if (value instanceof FeatureStructure) {
                ((FeatureStructure) value).flatten(name + ".", out);
            } else {
                out.add(name + "=" + value);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return features.equals(((FeatureStructure) o).features);
    }

    @Override
    public int hashCode() {
        return features.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        boolean first = true;
        for (Map.Entry<String, FeatureValue> entry : features.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            if (entry.getValue() instanceof FlagValue) {
                sb.append(entry.getValue()).append(entry.getKey());
            } else {
                sb.append(entry.getKey()).append('=').append(entry.getValue());
            }
        }
        return sb.append(']').toString();
    }

    /**
     * Accumulates attributes for a new FeatureStructure. Adding the same attribute twice is an error.
     */
    public static final class Builder {

        private final SortedMap<String, FeatureValue> features = new TreeMap<>();

        private Builder() { }

        public Builder flag(final String name, final boolean value) {
            return put(name, FlagValue.of(value));
        }

        public Builder atom(final String name, final String value) {
            return put(name, AtomValue.of(value));
        }

        public Builder nested(final String name, final FeatureStructure value) {
            return put(name, value);
        }

        public Builder put(final String name, final FeatureValue value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            if (features.putIfAbsent(name, value) != null) {
                throw new IllegalArgumentException("Attribute " + name + " is already set");
            }
            return this;
        }

        boolean has(final String name) {
            return features.containsKey(name);
        }

        public FeatureStructure build() {
            if (features.isEmpty()) {
                return EMPTY;
            }
            return new FeatureStructure(Collections.unmodifiableSortedMap(new TreeMap<>(features)));
        }
    }
}
