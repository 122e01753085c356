package org.dxworks.cobolsim.model.expression;

import java.math.BigDecimal;

public final class NumericLiteral implements Operand {
    public final BigDecimal value;

    public NumericLiteral(BigDecimal value) {
        this.value = value;
    }

    public static NumericLiteral parse(String text) {
        return new NumericLiteral(new BigDecimal(text));
    }

    @Override
    public String describe() {
        return value.toPlainString();
    }
}
