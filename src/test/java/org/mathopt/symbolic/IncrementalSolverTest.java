package org.mathopt.symbolic;

import org.mathopt.core.LinearConstraint;
import org.mathopt.core.Model;
import org.mathopt.core.Variable;
import org.mathopt.exceptions.UsedAfterRemovalException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IncrementalSolverTest {

    private static final double EPSILON = 1e-9;

    private Model model;

    private Variable x;

    private Variable y;

    private LinearConstraint c;

    @BeforeEach
    void setUp() {
        model = new Model("incremental");
        x = model.addIntegerVariable(0.0, 1.0, "x");
        y = model.addVariable(0.0, 2.5, false, "y");
        c = model.addLinearConstraint(x.times(2.0).plus(y).le(1.5), "c");
        model.maximize(x.times(2.0).plus(y));
    }

    @Test
    @DisplayName("模型没有变化时返回缓存的结果")
    void testCachedResult() {
        try (IncrementalSolver solver = new IncrementalSolver(model, SolverType.Z3, null)) {
            SolveResult first = solver.solve();
            SolveResult second = solver.solve();

            assertEquals(1.5, first.getObjectiveValue(), EPSILON);
            assertSame(first, second);
        }
    }

    @Test
    @DisplayName("模型修改后镜像与模型保持一致并重新求解")
    void testMirrorFollowsModel() {
        try (IncrementalSolver solver = new IncrementalSolver(model, SolverType.Z3, SolveParameters.defaults())) {
            solver.solve();

            c.setUpperBound(3.0);
            Variable z = model.addVariable(0.0, 1.0, false, "z");
            model.getObjective().add(z.times(5.0));
            model.deleteVariable(y);

            SolveResult result = solver.solve();

            assertAll("After update",
                    () -> assertEquals(model.exportModel(), solver.getMirror().exportModel(false)),
                    () -> assertEquals(7.0, result.getObjectiveValue(), EPSILON),
                    () -> assertEquals(1.0, result.getVariableValue(x), EPSILON),
                    () -> assertEquals(1.0, result.getVariableValue(z), EPSILON)
            );
        }
    }

    @Test
    @DisplayName("关闭后跟踪器从模型中移除")
    void testCloseRemovesTracker() {
        IncrementalSolver solver = new IncrementalSolver(model, SolverType.Z3, null);
        assertEquals(1, model.getElemental().numDiffs());

        solver.close();

        assertEquals(0, model.getElemental().numDiffs());
        assertThrows(UsedAfterRemovalException.class, solver::solve);
    }
}
