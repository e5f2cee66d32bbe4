package org.symbex.symbolic;

import org.symbex.expressions.Term;

/**
 * 满足路径条件的一组具体取值。
 */
public interface SolverModel {

    /**
     * 在模型中求项的值，结果总是可移植的：
     * 整数为 {@code Long} 或 {@code BigInteger}，实数为十进制字符串，布尔与字符串为原生类型，
     * 列表为 {@code List}，字典为 {@code Map}，无法求值时为 null。
     */
    Object evaluate(Term term);
}
