package org.symbex.expressions;

/**
 * 求解器项的运算符。{@link Style} 只决定可读输出的形式。
 */
public enum TermOperator {

    // 算术
    ADD("+", Style.INFIX),
    SUB("-", Style.INFIX),
    MUL("*", Style.INFIX),
    REAL_DIV("/", Style.INFIX),
    /** 向下取整的整数除法 */
    FLOOR_DIV("//", Style.INFIX),
    /** 结果与除数同号的取模 */
    FLOOR_MOD("%", Style.INFIX),
    /** 向零截断的整数除法 */
    TRUNC_DIV("trunc_div", Style.CALL),
    /** 结果与被除数同号的余数 */
    TRUNC_REM("trunc_rem", Style.CALL),
    NEG("-", Style.PREFIX),
    TO_REAL("real", Style.CALL),
    /** 实数向下取整为整数 */
    FLOOR("floor", Style.CALL),

    // 比较与逻辑
    EQ("==", Style.INFIX),
    NE("!=", Style.INFIX),
    LT("<", Style.INFIX),
    LE("<=", Style.INFIX),
    GT(">", Style.INFIX),
    GE(">=", Style.INFIX),
    NOT("not ", Style.PREFIX),
    AND("and", Style.INFIX),
    OR("or", Style.INFIX),
    ITE("ite", Style.CALL),

    // 字符串
    STR_CONCAT("+", Style.INFIX),
    STR_LENGTH("len", Style.CALL),
    /** (haystack, needle) */
    STR_CONTAINS("contains", Style.CALL),
    /** (s, prefix) */
    STR_PREFIX("startswith", Style.CALL),
    /** (s, suffix) */
    STR_SUFFIX("endswith", Style.CALL),
    /** (s, index)，长度为 1 的子串 */
    STR_AT("char_at", Style.CALL),
    /** 非负整数的十进制表示 */
    STR_FROM_INT("digits", Style.CALL),

    // 序列（列表）
    SEQ_LITERAL("list", Style.CALL),
    SEQ_LENGTH("len", Style.CALL),
    SEQ_NTH("nth", Style.CALL),
    SEQ_CONCAT("+", Style.INFIX),
    /** (seq, item) */
    SEQ_CONTAINS("contains", Style.CALL),
    /** (seq, index, value)，返回替换一个元素后的新序列 */
    SEQ_UPDATE("update", Style.CALL),

    // 映射（字典）：键集合数组加值数组
    DICT_GET("get", Style.CALL),
    DICT_HAS("has_key", Style.CALL),
    DICT_PUT("put", Style.CALL);

    public enum Style { INFIX, PREFIX, CALL }

    private final String symbol;
    private final Style style;

    TermOperator(String symbol, Style style) {
        this.symbol = symbol;
        this.style = style;
    }

    public String getSymbol() {
        return symbol;
    }

    public Style getStyle() {
        return style;
    }

    public boolean isComparison() {
        return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
    }
}
