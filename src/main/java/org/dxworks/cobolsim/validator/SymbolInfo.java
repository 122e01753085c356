package org.dxworks.cobolsim.validator;

import org.dxworks.cobolsim.model.DataSection;
import org.dxworks.cobolsim.model.PicType;
import org.dxworks.cobolsim.model.VariableDeclaration;

/**
 * What the semantic validator knows about a declared data item.
 */
public final class SymbolInfo {
    public final String name;
    public final int level;
    public final PicType type;
    public final int length;
    public final DataSection section;
    public final int line;

    public SymbolInfo(String name, int level, PicType type, int length, DataSection section, int line) {
        this.name = name;
        this.level = level;
        this.type = type;
        this.length = length;
        this.section = section;
        this.line = line;
    }

    public static SymbolInfo of(VariableDeclaration declaration) {
        return new SymbolInfo(declaration.name, declaration.level, declaration.picType, declaration.length,
                declaration.section, declaration.line);
    }

    public boolean isNumeric() {
        return type == PicType.NUMERIC;
    }
}
