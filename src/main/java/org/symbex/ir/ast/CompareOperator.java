package org.symbex.ir.ast;

/**
 * 比较运算符枚举
 */
public enum CompareOperator {

    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    /** 成员测试，右操作数是容器 */
    IN("in"),
    NOT_IN("not in");

    private final String symbol;

    CompareOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 返回此比较的否定。例如 LT 的否定是 GE。
     */
    public CompareOperator negate() {
        return switch (this) {
            case EQ -> NE;
            case NE -> EQ;
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
            case IN -> NOT_IN;
            case NOT_IN -> IN;
        };
    }
}
