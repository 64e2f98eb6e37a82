package org.l3.morpho.cascade.fs;

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * A symbolic feature value such as {@code sg} in {@code num=sg}.
 */
@Immutable
public final class AtomValue implements FeatureValue {

    private final String value;

    private AtomValue(final String value) {
        this.value = value;
    }

    public static AtomValue of(final String value) {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Atom values may not be empty");
        }
        return new AtomValue(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public FeatureValue unify(final FeatureValue other) {
        return equals(other) ? this : null;
    }

    @Override
    public int specificity() {
        return 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((AtomValue) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
