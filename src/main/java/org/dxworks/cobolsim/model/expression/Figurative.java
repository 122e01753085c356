package org.dxworks.cobolsim.model.expression;

/**
 * ZERO or SPACE; fills the whole receiving item.
 */
public final class Figurative implements Operand {
    public final FigurativeConstant constant;

    public Figurative(FigurativeConstant constant) {
        this.constant = constant;
    }

    @Override
    public String describe() {
        return constant.name();
    }
}
