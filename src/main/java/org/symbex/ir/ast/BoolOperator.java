package org.symbex.ir.ast;

public enum BoolOperator {

    AND("and"),
    OR("or");

    private final String symbol;

    BoolOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
