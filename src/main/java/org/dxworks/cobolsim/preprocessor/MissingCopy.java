package org.dxworks.cobolsim.preprocessor;

/**
 * A COPY statement whose copybook is not in the library. Line and column are 1-based and
 * point at the COPY keyword.
 */
public final class MissingCopy {
    public final String name;
    public final int line;
    public final int column;

    public MissingCopy(String name, int line, int column) {
        this.name = name;
        this.line = line;
        this.column = column;
    }

    @Override
    public String toString() {
        return "MissingCopy{" + name + " at " + line + ":" + column + "}";
    }
}
