package org.l3.morpho.cascade.fs;

/**
 * A RuntimeException that indicates an error parsing the text form of a feature structure.
 */
public class FeatureStructureParseException extends RuntimeException {

    public FeatureStructureParseException(String msg) {
        super(msg);
    }

}
