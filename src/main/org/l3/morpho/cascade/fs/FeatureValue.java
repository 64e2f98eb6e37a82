package org.l3.morpho.cascade.fs;

/**
 * The value of one attribute in a FeatureStructure. A value is a boolean flag, an atom, or a nested
 * FeatureStructure. All implementations are immutable and compare by value.
 */
public interface FeatureValue {

    /**
     * Unify this value with another.
     *
     * @param other the value to unify with
     * @return the unified value, or null if the two values are incompatible
     */
    FeatureValue unify(FeatureValue other);

    /**
     * Number of leaf values carried by this value; used to rank more specified analyses first.
     */
    int specificity();
}
