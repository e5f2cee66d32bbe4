package org.symbex.symbolic;

/**
 * 单次可满足性检查的结果。
 */
public enum SolverStatus {
    SAT,
    UNSAT,
    /** 超时、求解器放弃或约束无法降级 */
    UNKNOWN
}
