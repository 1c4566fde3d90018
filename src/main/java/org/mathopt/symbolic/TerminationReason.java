package org.mathopt.symbolic;

/**
 * 求解结束的原因。
 */
public enum TerminationReason {
    OPTIMAL,
    INFEASIBLE,
    UNBOUNDED,
    /** 超时或求解器无法判定。 */
    NO_SOLUTION_FOUND
}
