package org.dxworks.cobolsim.model;

/**
 * Source lines covered by a node of the program tree, 1-based and inclusive.
 */
public final class SourceSpan {
    public final int startLine;
    public final int startColumn;
    public final int endLine;

    public SourceSpan(int startLine, int startColumn, int endLine) {
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = Math.max(startLine, endLine);
    }

    public static SourceSpan at(int line, int column) {
        return new SourceSpan(line, column, line);
    }

    public SourceSpan extendTo(int line) {
        return new SourceSpan(startLine, startColumn, line);
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine;
    }
}
