package org.l3.morpho.cascade;

/**
 * A class declaration subtracts from a class that has not been declared on an earlier line.
 */
public class UndefinedClassException extends CompileException {

    private final String className;

    public UndefinedClassException(final String source, final int line, final String className) {
        super(source, line, "Undefined class " + className);
        this.className = className;
    }

    public String getClassName() {
        return className;
    }
}
