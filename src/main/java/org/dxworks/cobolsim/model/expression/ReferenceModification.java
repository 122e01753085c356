package org.dxworks.cobolsim.model.expression;

/**
 * {@code item(start:length)}, 1-based start.
 */
public final class ReferenceModification {
    public final int start;
    public final int length;

    public ReferenceModification(int start, int length) {
        this.start = start;
        this.length = length;
    }

    @Override
    public String toString() {
        return "(" + start + ":" + length + ")";
    }
}
