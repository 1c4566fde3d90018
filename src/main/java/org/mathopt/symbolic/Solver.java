package org.mathopt.symbolic;

import org.mathopt.elemental.ModelSnapshot;

/**
 * 外部求解器的窄接口：接收模型快照，返回求解结果。
 */
public interface Solver {

    SolveResult solve(ModelSnapshot model, SolveParameters parameters);
}
