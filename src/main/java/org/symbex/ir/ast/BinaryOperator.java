package org.symbex.ir.ast;

public enum BinaryOperator {

    ADD("+"),
    SUB("-"),
    MUL("*"),
    /** 除法。语义由方言决定：Python 为真除法，Java 整数除法向零截断 */
    DIV("/"),
    FLOOR_DIV("//"),
    MOD("%"),
    POW("**");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
