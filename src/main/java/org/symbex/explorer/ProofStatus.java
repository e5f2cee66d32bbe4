package org.symbex.explorer;

/**
 * 断言证明的结论。
 */
public enum ProofStatus {
    /** 在前置条件下断言恒成立 */
    VALID,
    /** 存在反例 */
    INVALID,
    /** 求解器无法判定 */
    UNKNOWN
}
