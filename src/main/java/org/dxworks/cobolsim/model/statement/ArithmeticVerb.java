package org.dxworks.cobolsim.model.statement;

/**
 * Arithmetic statement forms. For each form, {@code value} is the first operand and
 * {@code target} the second one as written in the source.
 */
public enum ArithmeticVerb {
    /** ADD value TO target: target + value */
    ADD(StatementKind.ADD),
    /** SUBTRACT value FROM target: target - value */
    SUBTRACT(StatementKind.SUBTRACT),
    /** MULTIPLY value BY target: target * value */
    MULTIPLY(StatementKind.MULTIPLY),
    /** DIVIDE value INTO target: target / value */
    DIVIDE_INTO(StatementKind.DIVIDE),
    /** DIVIDE value BY target GIVING result: value / target */
    DIVIDE_BY(StatementKind.DIVIDE);

    private final StatementKind kind;

    ArithmeticVerb(StatementKind kind) {
        this.kind = kind;
    }

    public StatementKind getKind() {
        return kind;
    }

    public String keyword() {
        return kind.name();
    }
}
