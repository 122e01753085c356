package org.dxworks.cobolsim.model;

import org.dxworks.cobolsim.model.expression.Operand;

/**
 * An elementary data item: level, name, PICTURE-derived type and length, optional VALUE.
 */
public final class VariableDeclaration {
    public final int level;
    public final String name;
    public final PicType picType;
    public final int length;
    public final String picture;
    /** Literal or figurative constant from the VALUE clause; null when absent. */
    public final Operand initialValue;
    public final DataSection section;
    public final int line;
    public final int column;

    public VariableDeclaration(int level, String name, PicType picType, int length, String picture,
                               Operand initialValue, DataSection section, int line, int column) {
        this.level = level;
        this.name = name;
        this.picType = picType;
        this.length = length;
        this.picture = picture;
        this.initialValue = initialValue;
        this.section = section;
        this.line = line;
        this.column = column;
    }

    public boolean isNumeric() {
        return picType == PicType.NUMERIC;
    }
}
