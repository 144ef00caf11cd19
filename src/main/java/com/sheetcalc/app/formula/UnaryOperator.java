package com.sheetcalc.app.formula;

public enum UnaryOperator {
    PLUS("+"),
    NEGATE("-");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
