package org.l3.morpho.cascade.input;

import javax.annotation.concurrent.Immutable;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One side of a label. Whether a NAME is a class or a literal symbol is decided by the build pass, since it depends
 * on the classes declared so far.
 */
@Immutable
public final class LabelPattern {

    public enum Kind {
        EPSILON,     // no symbol
        NAME,        // class name or literal symbol
        DIFFERENCE,  // Class-a,b
        INTERSECTION,  // L1&L2
    }

    static final LabelPattern EPSILON = new LabelPattern(Kind.EPSILON, "", Collections.emptyList(),
            Collections.emptyList());

    private final Kind kind;
    private final String name;
    private final List<String> subtracted;
    private final List<LabelPattern> parts;

    private LabelPattern(final Kind kind, final String name, final List<String> subtracted,
                         final List<LabelPattern> parts) {
        this.kind = kind;
        this.name = name;
        this.subtracted = subtracted;
        this.parts = parts;
    }

    static LabelPattern name(final String name) {
        return new LabelPattern(Kind.NAME, name, Collections.emptyList(), Collections.emptyList());
    }

    static LabelPattern difference(final String base, final List<String> subtracted) {
        return new LabelPattern(Kind.DIFFERENCE, base, Collections.unmodifiableList(subtracted),
                Collections.emptyList());
    }

    static LabelPattern intersection(final List<LabelPattern> parts) {
        return new LabelPattern(Kind.INTERSECTION, "", Collections.emptyList(), Collections.unmodifiableList(parts));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The symbol or class name; for a DIFFERENCE, the class subtracted from; empty for an INTERSECTION.
     */
    public String getName() {
        return name;
    }

    public List<String> getSubtracted() {
        return subtracted;
    }

    /**
     * The patterns an INTERSECTION keeps the common members of, each a NAME or a DIFFERENCE.
     */
    public List<LabelPattern> getParts() {
        return parts;
    }

    public boolean isEpsilon() {
        return kind == Kind.EPSILON;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LabelPattern that = (LabelPattern) o;
        return kind == that.kind && name.equals(that.name) && subtracted.equals(that.subtracted) &&
                parts.equals(that.parts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, subtracted, parts);
    }

    @Override
    public String toString() {
        switch (kind) {
            case EPSILON:
                return "";
            case DIFFERENCE:
                return name + "-" + String.join(",", subtracted);
            case INTERSECTION:
                StringBuilder joined = new StringBuilder();
                for (LabelPattern part : parts) {
                    if (joined.length() > 0) {
                        joined.append('&');
                    }
                    joined.append(part);
                }
                return joined.toString();
            default:
                return name;
        }
    }
}
