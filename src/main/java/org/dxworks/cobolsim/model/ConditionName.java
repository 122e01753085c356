package org.dxworks.cobolsim.model;

import org.dxworks.cobolsim.model.expression.Operand;

/**
 * Level-88 entry: a named test of its parent item against a single value.
 */
public final class ConditionName {
    public final String name;
    public final String parent;
    public final Operand value;
    public final int line;
    public final int column;

    public ConditionName(String name, String parent, Operand value, int line, int column) {
        this.name = name;
        this.parent = parent;
        this.value = value;
        this.line = line;
        this.column = column;
    }
}
