package org.mathopt.core;

import org.apache.commons.lang3.tuple.Triple;
import org.mathopt.elemental.ModelUpdate;
import org.mathopt.elemental.ElementType;
import org.mathopt.elemental.AttrKey;
import org.mathopt.elemental.DoubleAttr2;
import org.mathopt.exceptions.AmbiguousConstructionException;
import org.mathopt.exceptions.TypeMismatchException;
import org.mathopt.exceptions.UnknownElementException;
import org.mathopt.exceptions.UsedAfterRemovalException;
import org.mathopt.expressions.LinearExpression;
import org.mathopt.expressions.QuadraticExpression;
import org.mathopt.expressions.QuadraticTermKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private Model model;

    private Variable x;

    private Variable y;

    @BeforeEach
    void setUp() {
        model = new Model("model_test");
        x = model.addVariable(0.0, 1.0, true, "x");
        y = model.addVariable(0.0, 2.5, false, "y");
    }

    @Nested
    @DisplayName("变量")
    class VariableTests {

        @Test
        @DisplayName("变量的属性通过句柄读写")
        void testVariableAttributes() {
            y.setUpperBound(4.0);
            y.setInteger(true);

            assertAll("Variable",
                    () -> assertEquals("x", x.getName()),
                    () -> assertEquals(0.0, x.getLowerBound()),
                    () -> assertEquals(1.0, x.getUpperBound()),
                    () -> assertTrue(x.isInteger()),
                    () -> assertEquals(4.0, y.getUpperBound()),
                    () -> assertTrue(y.isInteger()),
                    () -> assertEquals(List.of(x, y), model.variables()),
                    () -> assertEquals(y, model.getVariable(y.getId())),
                    () -> assertEquals(2, model.numVariables())
            );
        }

        @Test
        @DisplayName("已删除的变量不能再使用")
        void testDeletedVariable() {
            model.deleteVariable(x);

            assertAll("Deleted variable",
                    () -> assertFalse(model.hasVariable(x.getId())),
                    () -> assertEquals("<deleted variable 0>", x.toString()),
                    () -> assertThrows(UnknownElementException.class, x::getLowerBound),
                    () -> assertThrows(UnknownElementException.class, () -> model.deleteVariable(x)),
                    () -> assertThrows(UnknownElementException.class, () -> model.getVariable(x.getId())),
                    () -> assertThrows(UnknownElementException.class, () -> model.addLinearConstraint(x.le(1.0)))
            );
        }

        @Test
        @DisplayName("其他模型的变量被拒绝")
        void testForeignVariable() {
            Variable foreign = new Model("other").addVariable("w");

            assertThrows(TypeMismatchException.class, () -> model.checkCompatible(foreign));
            assertThrows(TypeMismatchException.class, () -> model.deleteVariable(foreign));
            assertThrows(TypeMismatchException.class, () -> model.addLinearConstraint(foreign.plus(x).le(1.0)));
        }

        @Test
        @DisplayName("没有名称的变量以 id 显示")
        void testUnnamedVariable() {
            Variable unnamed = model.addVariable(null);

            assertEquals("variable_2", unnamed.toString());
        }
    }

    @Nested
    @DisplayName("线性约束")
    class LinearConstraintTests {

        @Test
        @DisplayName("2*x + y <= 1.5 被存为 (-inf, 1.5, {x:2, y:1})")
        void testAddLinearConstraint() {
            LinearConstraint c = model.addLinearConstraint(x.times(2.0).plus(y).le(1.5), "c");

            assertAll("Stored constraint",
                    () -> assertEquals("c", c.getName()),
                    () -> assertEquals(Double.NEGATIVE_INFINITY, c.getLowerBound()),
                    () -> assertEquals(1.5, c.getUpperBound()),
                    () -> assertEquals(2.0, c.getCoefficient(x)),
                    () -> assertEquals(1.0, c.getCoefficient(y)),
                    () -> assertEquals(List.of(x, y), model.rowNonzeros(c)),
                    () -> assertEquals(List.of(c), model.columnNonzeros(x))
            );
        }

        @Test
        @DisplayName("分开给出 lb、ub、expr 与给出有界表达式等价")
        void testSeparateParts() {
            LinearConstraint bounded = model.addLinearConstraint(x.plus(y).plus(1.0).ge(0.0).le(2.0), "b");
            LinearConstraint separate = model.addLinearConstraint(null, 0.0, 2.0, x.plus(y).plus(1.0), "s");

            assertAll("Equivalent",
                    () -> assertEquals(bounded.getLowerBound(), separate.getLowerBound()),
                    () -> assertEquals(bounded.getUpperBound(), separate.getUpperBound()),
                    () -> assertEquals(bounded.terms(), separate.terms()),
                    () -> assertThrows(AmbiguousConstructionException.class,
                            () -> model.addLinearConstraint(x.le(1.0), 0.0, null, null, "bad"))
            );
        }

        @Test
        @DisplayName("非法的约束不会留下半成品元素")
        void testFailedAddLeavesNoElement() {
            assertThrows(AmbiguousConstructionException.class,
                    () -> model.addLinearConstraint(x.le(1.0), null, 1.0, null, "bad"));

            assertEquals(0, model.numLinearConstraints());
        }

        @Test
        @DisplayName("修改系数和界")
        void testModifyConstraint() {
            LinearConstraint c = model.addLinearConstraint(x.le(1.0), "c");

            c.setCoefficient(y, 3.0);
            c.setCoefficient(x, 0.0);
            c.setLowerBound(-1.0);

            assertAll("Modified",
                    () -> assertEquals(List.of(y), model.rowNonzeros(c)),
                    () -> assertTrue(model.columnNonzeros(x).isEmpty()),
                    () -> assertEquals(-1.0, c.getLowerBound()),
                    () -> assertEquals(LinearExpression.of(Map.of(y, 3.0)), c.asBoundedLinearExpression().getExpression())
            );
        }

        @Test
        @DisplayName("删除变量后约束行与矩阵中不再出现该变量")
        void testDeleteVariableCascade() {
            LinearConstraint c1 = model.addLinearConstraint(x.plus(y).le(1.0), "c1");
            LinearConstraint c2 = model.addLinearConstraint(x.times(3.0).ge(0.0), "c2");

            model.deleteVariable(x);

            assertAll("Cascade",
                    () -> assertEquals(List.of(y), model.rowNonzeros(c1)),
                    () -> assertTrue(model.rowNonzeros(c2).isEmpty()),
                    () -> assertEquals(List.of(Triple.of(c1, y, 1.0)), model.linearConstraintMatrixEntries()),
                    () -> assertEquals(2, model.numLinearConstraints())
            );
        }

        @Test
        @DisplayName("删除约束后句柄失效")
        void testDeleteConstraint() {
            LinearConstraint c = model.addLinearConstraint(x.le(1.0), "c");

            model.deleteLinearConstraint(c);

            assertAll("Deleted constraint",
                    () -> assertEquals(0, model.numLinearConstraints()),
                    () -> assertTrue(model.columnNonzeros(x).isEmpty()),
                    () -> assertThrows(UnknownElementException.class, c::getUpperBound),
                    () -> assertThrows(UnknownElementException.class, () -> model.deleteLinearConstraint(c)),
                    () -> assertThrows(UnknownElementException.class, () -> model.getLinearConstraint(c.getId()))
            );
        }

        @Test
        @DisplayName("矩阵元素按 (约束, 变量) 升序")
        void testMatrixEntries() {
            LinearConstraint c1 = model.addLinearConstraint(y.plus(x.times(2.0)).le(1.0), "c1");
            LinearConstraint c2 = model.addLinearConstraint(x.times(-1.0).ge(0.0), "c2");

            List<Triple<LinearConstraint, Variable, Double>> entries = model.linearConstraintMatrixEntries();

            assertEquals(List.of(Triple.of(c1, x, 2.0), Triple.of(c1, y, 1.0), Triple.of(c2, x, -1.0)), entries);
        }
    }

    @Nested
    @DisplayName("二次约束与指示约束")
    class OtherConstraintTests {

        @Test
        @DisplayName("5*x*x == 3 被存为二次约束")
        void testQuadraticConstraint() {
            QuadraticConstraint q = model.addQuadraticConstraint(x.times(5.0).times(x).eq(3.0), "q");

            assertAll("Quadratic constraint",
                    () -> assertEquals(3.0, q.getLowerBound()),
                    () -> assertEquals(3.0, q.getUpperBound()),
                    () -> assertEquals(5.0, q.getQuadraticCoefficient(x, x)),
                    () -> assertEquals(1, model.numQuadraticConstraints()),
                    () -> assertEquals(QuadraticExpression.of(Map.of(QuadraticTermKey.of(x, x), 5.0), Map.of(), 0.0),
                            q.asBoundedQuadraticExpression().getExpression())
            );
        }

        @Test
        @DisplayName("删除变量会删除二次约束中含有它的项")
        void testQuadraticCascade() {
            QuadraticConstraint q = model.addQuadraticConstraint(x.times(y).plus(y).le(2.0), "q");

            model.deleteVariable(x);

            assertTrue(q.quadraticTerms().isEmpty());
            assertEquals(1.0, q.getLinearCoefficient(y));
        }

        @Test
        @DisplayName("删除指示变量后指示约束没有指示变量")
        void testIndicatorReset() {
            Variable z = model.addBinaryVariable("z");
            IndicatorConstraint indicator = model.addIndicatorConstraint(z, false, x.plus(y).le(1.0), "ind");

            assertEquals(Optional.of(z), indicator.getIndicator());

            model.deleteVariable(z);

            assertAll("Indicator reset",
                    () -> assertEquals(Optional.empty(), indicator.getIndicator()),
                    () -> assertEquals(1.0, indicator.getUpperBound()),
                    () -> assertEquals(1.0, indicator.getCoefficient(x)),
                    () -> assertEquals(1, model.numIndicatorConstraints())
            );
        }

        @Test
        @DisplayName("指示约束的蕴含约束")
        void testImpliedConstraint() {
            Variable z = model.addBinaryVariable("z");
            IndicatorConstraint indicator = model.addIndicatorConstraint(z, true, null, 1.0, null, y.plus(1.0), "ind");

            assertAll("Implied",
                    () -> assertTrue(indicator.isActivateOnZero()),
                    () -> assertEquals(0.0, indicator.getImpliedConstraint().getLowerBound()),
                    () -> assertEquals(Double.POSITIVE_INFINITY, indicator.getImpliedConstraint().getUpperBound()),
                    () -> assertEquals(LinearExpression.of(Map.of(y, 1.0)), indicator.getImpliedConstraint().getExpression())
            );
        }
    }

    @Nested
    @DisplayName("目标")
    class ObjectiveTests {

        @Test
        @DisplayName("构造时指定主目标的名称")
        void testPrimaryObjectiveName() {
            assertAll("Names",
                    () -> assertEquals("cost", new Model("named", "cost").getObjective().getName()),
                    () -> assertEquals("", new Model("named", null).getObjective().getName()),
                    () -> assertEquals("", model.getObjective().getName())
            );
        }

        @Test
        @DisplayName("设置目标会替换原有的目标")
        void testSetObjective() {
            model.maximize(x.times(2.0).plus(y).plus(1.0));
            model.minimize(y.times(y).plus(3.0));

            PrimaryObjective objective = model.getObjective();
            assertAll("Replaced",
                    () -> assertFalse(objective.isMaximize()),
                    () -> assertEquals(3.0, objective.getOffset()),
                    () -> assertEquals(0.0, objective.getLinearCoefficient(x)),
                    () -> assertEquals(1.0, objective.getQuadraticCoefficient(y, y)),
                    () -> assertThrows(IllegalStateException.class, objective::asLinearExpression)
            );
        }

        @Test
        @DisplayName("add 在原有目标上累加")
        void testAddToObjective() {
            model.maximize(x.times(2.0).plus(y));
            model.getObjective().add(x.plus(5.0));

            assertEquals(LinearExpression.of(Map.of(x, 3.0, y, 1.0), 5.0), model.getObjective().asLinearExpression());
        }

        @Test
        @DisplayName("辅助目标只支持线性项")
        void testAuxiliaryObjective() {
            AuxiliaryObjective auxiliary = model.addAuxiliaryObjective(2, x.plus(y.times(3.0)).plus(1.0), true, "aux");

            assertAll("Auxiliary objective",
                    () -> assertEquals(2, auxiliary.getPriority()),
                    () -> assertTrue(auxiliary.isMaximize()),
                    () -> assertEquals(1.0, auxiliary.getOffset()),
                    () -> assertEquals(3.0, auxiliary.getLinearCoefficient(y)),
                    () -> assertEquals("aux", auxiliary.getName()),
                    () -> assertThrows(TypeMismatchException.class, () -> auxiliary.setToExpression(x.times(x))),
                    () -> assertEquals(3.0, auxiliary.getLinearCoefficient(y), "Failed set must not modify objective"),
                    () -> assertEquals(List.of(auxiliary), model.auxiliaryObjectives())
            );
        }

        @Test
        @DisplayName("删除变量会删除目标中的系数")
        void testObjectiveCascade() {
            model.minimize(x.times(x).plus(y.times(2.0)).plus(x));

            model.deleteVariable(x);

            assertEquals(QuadraticExpression.of(Map.of(), Map.of(y, 2.0), 0.0), model.getObjective().asQuadraticExpression());
        }
    }

    @Nested
    @DisplayName("更新跟踪器")
    class TrackerTests {

        @Test
        @DisplayName("跟踪器导出自检查点以来的变更")
        void testTracker() {
            LinearConstraint c = model.addLinearConstraint(x.le(1.0), "c");
            UpdateTracker tracker = model.addUpdateTracker();

            assertTrue(tracker.exportUpdate().isEmpty());

            c.setCoefficient(y, 2.0);
            Variable z = model.addVariable("z");

            ModelUpdate update = tracker.exportUpdate().orElseThrow();
            assertAll("Update",
                    () -> assertEquals(2.0, update.getAttributeUpdates(DoubleAttr2.LIN_CON_COEF)
                            .get(AttrKey.of(c.getId(), y.getId()))),
                    () -> assertEquals("z", update.getNewElements(ElementType.VARIABLE).get(z.getId()))
            );

            tracker.advanceCheckpoint();
            assertTrue(tracker.exportUpdate().isEmpty());
        }

        @Test
        @DisplayName("应用跟踪器的更新后副本与模型相同")
        void testTrackerReplica() {
            UpdateTracker tracker = model.addUpdateTracker();
            Model replica = model.copy(null);

            LinearConstraint c = model.addLinearConstraint(x.plus(y).le(2.0), "c");
            model.maximize(x.plus(y));
            model.deleteVariable(y);
            c.setUpperBound(3.0);

            replica.getElemental().applyUpdate(tracker.exportUpdate().orElseThrow());

            assertEquals(model.exportModel(), replica.exportModel());
        }

        @Test
        @DisplayName("移除后的跟踪器不能再使用")
        void testRemovedTracker() {
            UpdateTracker tracker = model.addUpdateTracker();
            model.removeUpdateTracker(tracker);

            assertThrows(UsedAfterRemovalException.class, tracker::exportUpdate);
            assertThrows(UsedAfterRemovalException.class, tracker::advanceCheckpoint);
            assertThrows(UsedAfterRemovalException.class, () -> model.removeUpdateTracker(tracker));
        }

        @Test
        @DisplayName("快照重建的模型与原模型导出相同")
        void testFromSnapshot() {
            model.addLinearConstraint(x.times(2.0).plus(y).le(1.5), "c");
            model.maximize(x.times(2.0).plus(y));

            Model rebuilt = Model.fromSnapshot(model.exportModel());

            assertEquals(model.exportModel(), rebuilt.exportModel());
            assertEquals(List.of("x", "y"), rebuilt.variables().stream().map(Variable::getName).toList());
        }
    }
}
