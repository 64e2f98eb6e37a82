package org.l3.morpho.cascade;

/**
 * A line of a rule or cascade file does not follow the rule language, or a file declares nothing to compile.
 */
public class SyntaxException extends CompileException {

    public SyntaxException(final String source, final int line, final String reason) {
        super(source, line, reason);
    }

    public SyntaxException(final String source, final int line, final String reason, final Throwable cause) {
        super(source, line, reason, cause);
    }
}
