package org.dxworks.cobolsim.model.expression;

public enum RelationalOperator {
    EQUAL("="),
    GREATER(">"),
    LESS("<");

    private final String symbol;

    RelationalOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean test(int comparison) {
        switch (this) {
            case EQUAL:
                return comparison == 0;
            case GREATER:
                return comparison > 0;
            case LESS:
                return comparison < 0;
            default:
                throw new IllegalStateException("Unknown operator " + this);
        }
    }
}
