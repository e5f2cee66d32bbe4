package org.symbex.core;

/**
 * 整数与实数混合运算 / 比较时的处理策略。
 */
public enum MixedNumericPolicy {

    /** 将整数一侧提升为实数后在实数理论中比较 */
    PROMOTE_TO_REAL,
    /** 放弃建模，结果为不受约束的不透明值 */
    OPAQUE
}
