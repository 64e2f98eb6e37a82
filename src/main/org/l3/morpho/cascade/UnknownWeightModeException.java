package org.l3.morpho.cascade;

/**
 * A cascade declares a weighting mode that is neither built in nor registered through the Configuration.
 */
public class UnknownWeightModeException extends CompileException {

    private final String mode;

    public UnknownWeightModeException(final String source, final int line, final String mode) {
        super(source, line, "Unknown weighting mode " + mode);
        this.mode = mode;
    }

    public String getMode() {
        return mode;
    }
}
