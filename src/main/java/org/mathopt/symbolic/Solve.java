package org.mathopt.symbolic;

import org.mathopt.core.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 一次性求解入口。
 */
public final class Solve {

    private static final Logger logger = LoggerFactory.getLogger(Solve.class);

    private Solve() {
    }

    public static SolveResult solve(Model model, SolverType solverType, SolveParameters parameters) {
        Objects.requireNonNull(model, "Solve: model 不能为 null");
        Objects.requireNonNull(solverType, "Solve: solverType 不能为 null");
        logger.info("使用 {} 求解模型 '{}'", solverType, model.getName());
        return solverType.newSolver().solve(model.exportModel(false),
                parameters == null ? SolveParameters.defaults() : parameters);
    }
}
