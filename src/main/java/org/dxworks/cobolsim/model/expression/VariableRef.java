package org.dxworks.cobolsim.model.expression;

public final class VariableRef implements Operand {
    public final String name;
    /** Null unless the reference carries {@code (start:length)}. */
    public final ReferenceModification refMod;
    public final int line;
    public final int column;

    public VariableRef(String name, ReferenceModification refMod, int line, int column) {
        this.name = name;
        this.refMod = refMod;
        this.line = line;
        this.column = column;
    }

    public VariableRef(String name, int line, int column) {
        this(name, null, line, column);
    }

    public boolean hasRefMod() {
        return refMod != null;
    }

    @Override
    public String describe() {
        return refMod == null ? name : name + refMod;
    }
}
