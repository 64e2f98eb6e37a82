package org.l3.morpho.cascade;

/**
 * A transition rule cannot be turned into transitions, e.g. because a label subtracts from an undefined class.
 */
public class MalformedAutomatonException extends CompileException {

    public MalformedAutomatonException(final String source, final int line, final String reason) {
        super(source, line, reason);
    }

    public MalformedAutomatonException(final String source, final int line, final String reason,
                                       final Throwable cause) {
        super(source, line, reason, cause);
    }
}
