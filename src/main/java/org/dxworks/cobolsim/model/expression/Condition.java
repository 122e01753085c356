package org.dxworks.cobolsim.model.expression;

/**
 * {@code left [NOT] op right}. Condition names are desugared into this form by the parser.
 */
public final class Condition {
    public final Operand left;
    public final RelationalOperator operator;
    public final Operand right;
    public final boolean negated;

    public Condition(Operand left, RelationalOperator operator, Operand right, boolean negated) {
        this.left = left;
        this.operator = operator;
        this.right = right;
        this.negated = negated;
    }

    public boolean hasOnlyLiterals() {
        return left.isLiteral() && right.isLiteral();
    }

    public String describe() {
        return left.describe() + (negated ? " NOT " : " ") + operator.getSymbol() + " " + right.describe();
    }
}
