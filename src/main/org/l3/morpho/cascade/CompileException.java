package org.l3.morpho.cascade;

/**
 * Signals that rule files could not be compiled into a Cascade. The message carries the source name and line, as
 * {@code source:line: reason}. A line of 0 means the problem is not tied to one line.
 *
 * Compilation reports every problem it finds: the first is thrown, the others are attached as suppressed exceptions.
 */
public class CompileException extends Exception {

    private final String source;
    private final int line;
    private final String reason;

    public CompileException(final String source, final int line, final String reason) {
        super(format(source, line, reason));
        this.source = source;
        this.line = line;
        this.reason = reason;
    }

    public CompileException(final String source, final int line, final String reason, final Throwable cause) {
        super(format(source, line, reason), cause);
        this.source = source;
        this.line = line;
        this.reason = reason;
    }

    private static String format(final String source, final int line, final String reason) {
        return line > 0 ? source + ":" + line + ": " + reason : source + ": " + reason;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    /**
     * The problem, without the source location.
     */
    public String getReason() {
        return reason;
    }
}
