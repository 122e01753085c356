package org.dxworks.cobolsim.model.expression;

public enum FigurativeConstant {
    ZERO('0'),
    SPACE(' ');

    private final char fill;

    FigurativeConstant(char fill) {
        this.fill = fill;
    }

    public char getFill() {
        return fill;
    }
}
