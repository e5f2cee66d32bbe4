package org.symbex.ir;

import lombok.Getter;

/**
 * 源语言的算术与下标语义。由 {@link Frontend} 在引擎运行前选定，引擎内部不再按语言分支。
 * 此类是不可变的。
 */
@Getter
public final class ArithmeticSemantics {

    /** Python：/ 为真除法，// 与 % 向下取整，实数除零抛出异常，负下标从末尾计数 */
    public static final ArithmeticSemantics PYTHON = new ArithmeticSemantics(true, true, true, true, false);

    /** Java：整数 / 与 % 向零截断，实数除零不抛出异常，下标不回绕 */
    public static final ArithmeticSemantics JAVA = new ArithmeticSemantics(false, false, false, false, false);

    /** JavaScript：所有数字都是实数，除法从不抛出异常 */
    public static final ArithmeticSemantics JAVASCRIPT = new ArithmeticSemantics(true, false, false, false, true);

    /** 整数之间的 / 是否产生实数 */
    private final boolean trueDivision;
    /** % 是否向下取整（结果与除数同号）；否则为截断余数（结果与被除数同号） */
    private final boolean flooredModulo;
    /** 实数除以零是否是错误 */
    private final boolean realDivisionByZeroRaises;
    /** 负下标是否从末尾计数 */
    private final boolean negativeIndexWraps;
    /** 整数字面量是否按实数处理 */
    private final boolean numbersAreReal;

    public ArithmeticSemantics(boolean trueDivision, boolean flooredModulo, boolean realDivisionByZeroRaises,
                               boolean negativeIndexWraps, boolean numbersAreReal) {
        this.trueDivision = trueDivision;
        this.flooredModulo = flooredModulo;
        this.realDivisionByZeroRaises = realDivisionByZeroRaises;
        this.negativeIndexWraps = negativeIndexWraps;
        this.numbersAreReal = numbersAreReal;
    }

    /**
     * 整数除法是否会因除数为零而出错。三种语言中，整数除零都是错误（JavaScript 中不存在整数）。
     */
    public boolean integerDivisionByZeroRaises() {
        return !numbersAreReal;
    }

    @Override
    public String toString() {
        return "ArithmeticSemantics(trueDivision=" + trueDivision + ", flooredModulo=" + flooredModulo
                + ", realDivisionByZeroRaises=" + realDivisionByZeroRaises
                + ", negativeIndexWraps=" + negativeIndexWraps + ", numbersAreReal=" + numbersAreReal + ")";
    }
}
