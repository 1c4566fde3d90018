package org.mathopt.expressions;

import org.mathopt.core.Model;
import org.mathopt.core.Variable;
import org.mathopt.core.VariableValuation;
import org.mathopt.exceptions.TypeMismatchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlattenerTest {

    private Model model;

    private Variable x;

    private Variable y;

    private Variable z;

    @BeforeEach
    void setUp() {
        model = new Model("flatten");
        x = model.addVariable(0.0, 1.0, true, "x");
        y = model.addVariable(0.0, 2.5, false, "y");
        z = model.addVariable("z");
    }

    @Nested
    @DisplayName("线性展平")
    class LinearTests {

        @Test
        @DisplayName("2*x + y 展平为 {x:2, y:1}，常数项为 0")
        void testSimpleSum() {
            LinearExpression flat = Flattener.asFlatLinearExpression(x.times(2.0).plus(y));

            assertAll("Flat form",
                    () -> assertEquals(0.0, flat.getOffset()),
                    () -> assertEquals(Map.of(x, 2.0, y, 1.0), flat.getTerms()),
                    () -> assertEquals(List.of(x, y), new ArrayList<>(flat.getTerms().keySet()))
            );
        }

        @Test
        @DisplayName("同一变量的多次出现被合并，合并后恰好为 0 的项被删除")
        void testMergeAndDropZero() {
            LinearBase expression = x.plus(y).plus(3.0).minus(x).plus(z.times(0.5)).plus(z.times(0.5));

            LinearExpression flat = Flattener.asFlatLinearExpression(expression);

            assertAll("Merged",
                    () -> assertEquals(3.0, flat.getOffset()),
                    () -> assertEquals(Map.of(y, 1.0, z, 1.0), flat.getTerms()),
                    () -> assertFalse(flat.getTerms().containsKey(x))
            );
        }

        @Test
        @DisplayName("数学上相等的不同写法得到相同的规范形式")
        void testCanonicalFormIsUnique() {
            LinearBase first = x.times(2.0).plus(y).plus(1.0);
            LinearBase second = LinearSum.of(LinearConstant.of(1.0), y, x, x);
            LinearBase third = y.plus(1.0).plus(x.plus(x).times(2.0)).minus(x.times(2.0));

            LinearExpression expected = Flattener.asFlatLinearExpression(first);
            assertEquals(expected, Flattener.asFlatLinearExpression(second));
            assertEquals(expected, Flattener.asFlatLinearExpression(third));
        }

        @Test
        @DisplayName("展平对加法是可加的")
        void testAdditivity() {
            LinearBase a = x.times(3.0).plus(2.0);
            LinearBase b = y.minus(x).plus(z.times(-4.0)).minus(1.0);

            LinearExpression flatA = Flattener.asFlatLinearExpression(a);
            LinearExpression flatB = Flattener.asFlatLinearExpression(b);
            LinearExpression flatSum = Flattener.asFlatLinearExpression(a.plus(b));

            assertAll("Additive",
                    () -> assertEquals(flatA.getOffset() + flatB.getOffset(), flatSum.getOffset()),
                    () -> assertEquals(flatA.getCoefficient(x) + flatB.getCoefficient(x), flatSum.getCoefficient(x)),
                    () -> assertEquals(flatA.getCoefficient(y) + flatB.getCoefficient(y), flatSum.getCoefficient(y)),
                    () -> assertEquals(flatA.getCoefficient(z) + flatB.getCoefficient(z), flatSum.getCoefficient(z))
            );
        }

        @Test
        @DisplayName("数乘对正数、负数和 0 都是线性的")
        void testScaling() {
            LinearBase expression = x.times(2.0).plus(y).plus(4.0);

            LinearExpression negative = Flattener.asFlatLinearExpression(expression.times(-3.0));
            LinearExpression zero = Flattener.asFlatLinearExpression(expression.times(0.0));
            LinearExpression divided = Flattener.asFlatLinearExpression(expression.dividedBy(2.0));

            assertAll("Scaling",
                    () -> assertEquals(LinearExpression.of(Map.of(x, -6.0, y, -3.0), -12.0), negative),
                    () -> assertTrue(zero.getTerms().isEmpty()),
                    () -> assertEquals(0.0, zero.getOffset()),
                    () -> assertEquals(LinearExpression.of(Map.of(x, 1.0, y, 0.5), 2.0), divided),
                    () -> assertEquals(LinearExpression.of(Map.of(x, -2.0, y, -1.0), -4.0),
                            Flattener.asFlatLinearExpression(expression.negate()))
            );
        }

        @Test
        @DisplayName("除以 0 抛出 ArithmeticException")
        void testDivideByZero() {
            assertThrows(ArithmeticException.class, () -> x.plus(y).dividedBy(0.0));
        }

        @Test
        @DisplayName("十万层深的求和树不会栈溢出")
        void testDeepTree() {
            LinearBase expression = x;
            for (int i = 0; i < 100_000; i++) {
                expression = expression.plus(y);
            }

            LinearExpression flat = Flattener.asFlatLinearExpression(expression);

            assertEquals(1.0, flat.getCoefficient(x));
            assertEquals(100_000.0, flat.getCoefficient(y));
        }

        @Test
        @DisplayName("已经是规范形式的表达式原样返回")
        void testCanonicalShortCircuit() {
            LinearExpression flat = LinearExpression.of(Map.of(x, 1.0), 2.0);

            assertSame(flat, Flattener.asFlatLinearExpression(flat));
        }

        @Test
        @DisplayName("规范形式可以根据赋值求值")
        void testEvaluate() {
            LinearExpression flat = Flattener.asFlatLinearExpression(x.times(2.0).plus(y).plus(1.0));
            VariableValuation valuation = VariableValuation.of(Map.of(x, 1.0, y, 0.5));

            assertEquals(3.5, flat.evaluate(valuation));
            assertThrows(IllegalArgumentException.class,
                    () -> flat.evaluate(VariableValuation.of(Map.of(x, 1.0))));
        }
    }

    @Nested
    @DisplayName("二次展平")
    class QuadraticTests {

        @Test
        @DisplayName("5*x*x 展平为 {(x,x):5}")
        void testSquare() {
            QuadraticExpression flat = Flattener.asFlatQuadraticExpression(x.times(5.0).times(x));

            assertAll("Square",
                    () -> assertEquals(5.0, flat.getQuadraticCoefficient(x, x)),
                    () -> assertTrue(flat.getLinearTerms().isEmpty()),
                    () -> assertEquals(0.0, flat.getOffset())
            );
        }

        @Test
        @DisplayName("线性乘线性按分配律展开")
        void testLinearTimesLinear() {
            QuadraticBase product = x.plus(1.0).times(y.times(2.0).plus(3.0));

            QuadraticExpression flat = Flattener.asFlatQuadraticExpression(product);

            assertAll("Distributed",
                    () -> assertEquals(2.0, flat.getQuadraticCoefficient(x, y)),
                    () -> assertEquals(2.0, flat.getQuadraticCoefficient(y, x)),
                    () -> assertEquals(3.0, flat.getLinearCoefficient(x)),
                    () -> assertEquals(2.0, flat.getLinearCoefficient(y)),
                    () -> assertEquals(3.0, flat.getOffset())
            );
        }

        @Test
        @DisplayName("x*y 与 y*x 是同一个二次项")
        void testQuadraticKeyIsUnordered() {
            QuadraticBase expression = x.times(y).plus(y.times(x)).minus(x.times(y).times(2.0));

            QuadraticExpression flat = Flattener.asFlatQuadraticExpression(expression);

            assertTrue(flat.getQuadraticTerms().isEmpty());
        }

        @Test
        @DisplayName("二次和与线性和可以混合")
        void testMixedSum() {
            QuadraticBase expression = x.times(x).plus(z).plus(2.0).times(3.0).minus(y);

            QuadraticExpression flat = Flattener.asFlatQuadraticExpression(expression);

            assertAll("Mixed",
                    () -> assertEquals(3.0, flat.getQuadraticCoefficient(x, x)),
                    () -> assertEquals(3.0, flat.getLinearCoefficient(z)),
                    () -> assertEquals(-1.0, flat.getLinearCoefficient(y)),
                    () -> assertEquals(6.0, flat.getOffset()),
                    () -> assertEquals(9.0, flat.evaluate(VariableValuation.of(Map.of(x, 1.0, y, 0.0, z, 0.0))))
            );
        }

        @Test
        @DisplayName("二次展平对加法是可加的，相互抵消的交叉项被删除")
        void testQuadraticAdditivity() {
            QuadraticBase a = x.times(y).times(2.0).plus(x).plus(1.0);
            QuadraticBase b = y.times(x).times(-2.0).plus(y.times(y)).plus(z.times(3.0));

            QuadraticExpression flatA = Flattener.asFlatQuadraticExpression(a);
            QuadraticExpression flatB = Flattener.asFlatQuadraticExpression(b);
            QuadraticExpression flatSum = Flattener.asFlatQuadraticExpression(a.plus(b));

            Map<QuadraticTermKey, Double> quadratic = new HashMap<>(flatA.getQuadraticTerms());
            flatB.getQuadraticTerms().forEach((key, value) -> quadratic.merge(key, value, Double::sum));
            Map<Variable, Double> linear = new HashMap<>(flatA.getLinearTerms());
            flatB.getLinearTerms().forEach((variable, value) -> linear.merge(variable, value, Double::sum));

            assertAll("Additive",
                    () -> assertEquals(QuadraticExpression.of(quadratic, linear, flatA.getOffset() + flatB.getOffset()), flatSum),
                    () -> assertFalse(flatSum.getQuadraticTerms().containsKey(QuadraticTermKey.of(x, y))),
                    () -> assertEquals(1.0, flatSum.getQuadraticCoefficient(y, y)),
                    () -> assertEquals(1.0, flatSum.getLinearCoefficient(x)),
                    () -> assertEquals(3.0, flatSum.getLinearCoefficient(z)),
                    () -> assertEquals(1.0, flatSum.getOffset())
            );
        }

        @Test
        @DisplayName("二次表达式的数乘对常数项、线性项和二次项都是线性的")
        void testQuadraticScaling() {
            QuadraticBase expression = x.times(y).times(2.0).plus(x.times(x)).plus(z.times(3.0)).plus(1.0);

            QuadraticExpression negative = Flattener.asFlatQuadraticExpression(expression.times(-3.0));
            QuadraticExpression zero = Flattener.asFlatQuadraticExpression(expression.times(0.0));
            QuadraticExpression doubled = Flattener.asFlatQuadraticExpression(expression.times(2.0));

            assertAll("Scaling",
                    () -> assertEquals(QuadraticExpression.of(
                            Map.of(QuadraticTermKey.of(x, y), -6.0, QuadraticTermKey.of(x, x), -3.0),
                            Map.of(z, -9.0), -3.0), negative),
                    () -> assertTrue(zero.getQuadraticTerms().isEmpty()),
                    () -> assertTrue(zero.getLinearTerms().isEmpty()),
                    () -> assertEquals(0.0, zero.getOffset()),
                    () -> assertEquals(QuadraticExpression.of(
                            Map.of(QuadraticTermKey.of(x, y), 4.0, QuadraticTermKey.of(x, x), 2.0),
                            Map.of(z, 6.0), 2.0), doubled)
            );
        }

        @Test
        @DisplayName("十万层深的二次求和树不会栈溢出")
        void testDeepQuadraticTree() {
            QuadraticBase expression = x.times(x);
            for (int i = 0; i < 100_000; i++) {
                expression = expression.plus(x.times(y));
            }

            QuadraticExpression flat = Flattener.asFlatQuadraticExpression(expression);

            assertEquals(1.0, flat.getQuadraticCoefficient(x, x));
            assertEquals(100_000.0, flat.getQuadraticCoefficient(x, y));
            assertTrue(flat.getLinearTerms().isEmpty());
        }

        @Test
        @DisplayName("线性表达式也可以按二次展平")
        void testLinearAsQuadratic() {
            QuadraticExpression flat = Flattener.asFlatQuadraticExpression(x.plus(2.0));

            assertEquals(1.0, flat.getLinearCoefficient(x));
            assertEquals(2.0, flat.getOffset());
            assertTrue(flat.getQuadraticTerms().isEmpty());
        }
    }

    @Nested
    @DisplayName("非法的操作数")
    class InvalidOperandTests {

        @Test
        @DisplayName("混用不同模型的变量抛出 TypeMismatchException")
        void testMixedModels() {
            Variable other = new Model("other").addVariable("w");

            assertThrows(TypeMismatchException.class, () -> Flattener.asFlatLinearExpression(x.plus(other)));
            assertThrows(TypeMismatchException.class, () -> Flattener.asFlatQuadraticExpression(x.times(other)));
        }

        @Test
        @DisplayName("null 操作数抛出 TypeMismatchException")
        void testNullOperand() {
            assertThrows(TypeMismatchException.class, () -> x.plus((LinearBase) null));
            assertThrows(TypeMismatchException.class, () -> LinearSum.of(x, null));
        }

        @Test
        @DisplayName("展平 null 或以 null 作为目标抛出 TypeMismatchException")
        void testFlattenNull() {
            assertAll("Null expression",
                    () -> assertThrows(TypeMismatchException.class, () -> Flattener.asFlatLinearExpression(null)),
                    () -> assertThrows(TypeMismatchException.class, () -> Flattener.asFlatQuadraticExpression(null)),
                    () -> assertThrows(TypeMismatchException.class, () -> model.minimize(null)),
                    () -> assertThrows(TypeMismatchException.class, () -> model.getObjective().setToExpression(null))
            );
        }
    }
}
