package org.mathopt.symbolic;

import org.mathopt.core.Model;
import org.mathopt.core.UpdateTracker;
import org.mathopt.elemental.Elemental;
import org.mathopt.elemental.ModelUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * 跟随用户模型变化的求解器。内部保存模型的一份镜像，每次求解前通过更新跟踪器
 * 取得自上次求解以来的变更并应用到镜像上；没有变更时直接返回上一次的结果。
 * 用完后必须 {@link #close()}，以便从模型中移除跟踪器。
 * @author Ayalyt
 */
public final class IncrementalSolver implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(IncrementalSolver.class);

    private final Model model;

    private final Solver solver;

    private final SolveParameters parameters;

    private final Elemental mirror;

    private final UpdateTracker tracker;

    private SolveResult lastResult;

    public IncrementalSolver(Model model, SolverType solverType, SolveParameters parameters) {
        this.model = Objects.requireNonNull(model, "IncrementalSolver: model 不能为 null");
        this.solver = Objects.requireNonNull(solverType, "IncrementalSolver: solverType 不能为 null").newSolver();
        this.parameters = parameters == null ? SolveParameters.defaults() : parameters;
        this.mirror = model.getElemental().copy(null);
        this.tracker = model.addUpdateTracker();
        logger.info("为模型 '{}' 创建增量求解器 ({})", model.getName(), solverType);
    }

    public SolveResult solve() {
        Optional<ModelUpdate> update = tracker.exportUpdate();
        if (update.isEmpty() && lastResult != null) {
            logger.info("模型 '{}' 自上次求解后没有变化，返回缓存结果", model.getName());
            return lastResult;
        }
        update.ifPresent(mirror::applyUpdate);
        tracker.advanceCheckpoint();
        lastResult = solver.solve(mirror.exportModel(false), parameters);
        return lastResult;
    }

    /**
     * 内部镜像，供测试检查镜像与模型是否一致。
     */
    Elemental getMirror() {
        return mirror;
    }

    @Override
    public void close() {
        model.removeUpdateTracker(tracker);
        logger.info("关闭模型 '{}' 的增量求解器", model.getName());
    }
}
