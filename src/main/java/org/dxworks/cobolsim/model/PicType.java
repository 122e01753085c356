package org.dxworks.cobolsim.model;

public enum PicType {
    ALPHANUMERIC("X"),
    NUMERIC("9");

    private final String symbol;

    PicType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
