package org.symbex.ir.ast;

public enum UnaryOperator {

    NEG("-"),
    POS("+"),
    NOT("not");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
