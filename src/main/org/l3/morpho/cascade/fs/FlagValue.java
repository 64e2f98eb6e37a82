package org.l3.morpho.cascade.fs;

/**
 * A boolean feature, written {@code +name} or {@code -name}. Two flags unify only if they have the same polarity.
 */
public enum FlagValue implements FeatureValue {
    PLUS,
    MINUS;

    public static FlagValue of(final boolean value) {
        return value ? PLUS : MINUS;
    }

    public boolean isSet() {
        return this == PLUS;
    }

    @Override
    public FeatureValue unify(final FeatureValue other) {
        return this == other ? this : null;
    }

    @Override
    public int specificity() {
        return 1;
    }

    @Override
    public String toString() {
        return this == PLUS ? "+" : "-";
    }
}
