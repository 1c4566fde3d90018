package org.mathopt.expressions.bounded;

import org.mathopt.core.Model;
import org.mathopt.core.Variable;
import org.mathopt.exceptions.AmbiguousConstructionException;
import org.mathopt.exceptions.InvalidBoundException;
import org.mathopt.expressions.LinearBase;
import org.mathopt.expressions.QuadraticBase;
import org.mathopt.expressions.QuadraticTermKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InequalityNormalizerTest {

    private Model model;

    private Variable x;

    private Variable y;

    @BeforeEach
    void setUp() {
        model = new Model("normalize");
        x = model.addBinaryVariable("x");
        y = model.addBinaryVariable("y");
    }

    @Nested
    @DisplayName("线性约束的规范化")
    class LinearTests {

        @Test
        @DisplayName("2*x + y <= 1.5 得到 (-inf, 1.5, {x:2, y:1})")
        void testUpperBounded() {
            NormalizedLinearInequality normalized = InequalityNormalizer.normalizeLinear(x.times(2.0).plus(y).le(1.5));

            assertAll("Upper bounded",
                    () -> assertEquals(Double.NEGATIVE_INFINITY, normalized.getLowerBound()),
                    () -> assertEquals(1.5, normalized.getUpperBound()),
                    () -> assertEquals(Map.of(x, 2.0, y, 1.0), normalized.getCoefficients())
            );
        }

        @Test
        @DisplayName("0 <= x + 2*y + 1 <= 2 的常数项从两侧界中减去")
        void testOffsetMovesIntoBounds() {
            BoundedExpression<LinearBase> bounded = x.plus(y.times(2.0)).plus(1.0).ge(0.0).le(2.0);

            NormalizedLinearInequality normalized = InequalityNormalizer.normalizeLinear(bounded);

            assertEquals(NormalizedLinearInequality.of(-1.0, 1.0, Map.of(x, 1.0, y, 2.0)), normalized);
        }

        @Test
        @DisplayName("先写上界再写下界结果相同")
        void testBoundOrderDoesNotMatter() {
            LinearBase expression = x.plus(y.times(2.0)).plus(1.0);

            assertEquals(InequalityNormalizer.normalizeLinear(expression.ge(0.0).le(2.0)),
                    InequalityNormalizer.normalizeLinear(expression.le(2.0).ge(0.0)));
            assertEquals(InequalityNormalizer.normalizeLinear(expression.ge(0.0).le(2.0)),
                    InequalityNormalizer.normalizeLinear(BoundedExpression.between(0.0, expression, 2.0)));
        }

        @Test
        @DisplayName("两侧都是表达式时右侧移到左侧")
        void testExpressionOnBothSides() {
            NormalizedLinearInequality normalized = InequalityNormalizer.normalizeLinear(x.le(y.plus(2.0)));

            assertAll("Both sides",
                    () -> assertEquals(Double.NEGATIVE_INFINITY, normalized.getLowerBound()),
                    () -> assertEquals(2.0, normalized.getUpperBound()),
                    () -> assertEquals(Map.of(x, 1.0, y, -1.0), normalized.getCoefficients())
            );
        }

        @Test
        @DisplayName("等式的两侧界相同")
        void testEquality() {
            NormalizedLinearInequality normalized = InequalityNormalizer.normalizeLinear(x.plus(y).plus(1.0).eq(3.0));

            assertEquals(2.0, normalized.getLowerBound());
            assertEquals(2.0, normalized.getUpperBound());
        }

        @Test
        @DisplayName("变量相等得到 x - y 属于 [0, 0]")
        void testVarEqVar() {
            VarEqVar equality = x.eq(y);

            NormalizedLinearInequality normalized = InequalityNormalizer.normalizeLinear(equality);

            assertEquals(NormalizedLinearInequality.of(0.0, 0.0, Map.of(x, 1.0, y, -1.0)), normalized);
        }

        @Test
        @DisplayName("分别给出 lb、ub、expr，缺省的部分取 -inf、+inf、0")
        void testSeparateParts() {
            assertAll("Separate parts",
                    () -> assertEquals(NormalizedLinearInequality.of(0.0, 2.0, Map.of(x, 1.0)),
                            InequalityNormalizer.normalizeLinear(null, 1.0, 3.0, x.plus(1.0))),
                    () -> assertEquals(NormalizedLinearInequality.of(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, Map.of()),
                            InequalityNormalizer.normalizeLinear(null, null, null, null)),
                    () -> assertEquals(NormalizedLinearInequality.of(Double.NEGATIVE_INFINITY, 4.0, Map.of(y, 1.0)),
                            InequalityNormalizer.normalizeLinear(null, null, 4.0, y))
            );
        }

        @Test
        @DisplayName("下界大于上界的约束照常创建")
        void testInvertedBoundsAreAccepted() {
            NormalizedLinearInequality normalized = InequalityNormalizer.normalizeLinear(null, 5.0, 1.0, x);

            assertEquals(5.0, normalized.getLowerBound());
            assertEquals(1.0, normalized.getUpperBound());
        }

        @Test
        @DisplayName("任意有限常数项 c 都满足 lb' = lb - c，ub' = ub - c")
        void testBoundShiftProperty() {
            double[] offsets = {0.0, 1.0, -2.5, 1e-9, 123456.75, -1e6};
            for (double offset : offsets) {
                NormalizedLinearInequality normalized = InequalityNormalizer.normalizeLinear(
                        BoundedExpression.between(-3.0, x.plus(offset), 7.0));
                assertEquals(-3.0 - offset, normalized.getLowerBound(), "offset " + offset);
                assertEquals(7.0 - offset, normalized.getUpperBound(), "offset " + offset);
            }
        }
    }

    @Nested
    @DisplayName("二次约束的规范化")
    class QuadraticTests {

        @Test
        @DisplayName("5*x*x == 3 得到 {(x,x):5}，lb = ub = 3")
        void testSquareEquality() {
            NormalizedQuadraticInequality normalized =
                    InequalityNormalizer.normalizeQuadratic(x.times(5.0).times(x).eq(3.0));

            assertAll("Square equality",
                    () -> assertEquals(3.0, normalized.getLowerBound()),
                    () -> assertEquals(3.0, normalized.getUpperBound()),
                    () -> assertEquals(Map.of(QuadraticTermKey.of(x, x), 5.0), normalized.getQuadraticCoefficients()),
                    () -> assertTrue(normalized.getLinearCoefficients().isEmpty())
            );
        }

        @Test
        @DisplayName("二次表达式与线性表达式比较")
        void testQuadraticAgainstLinear() {
            QuadraticBase square = x.times(x).plus(2.0);

            NormalizedQuadraticInequality normalized = InequalityNormalizer.normalizeQuadratic(square.le(y));

            assertAll("Quadratic vs linear",
                    () -> assertEquals(Double.NEGATIVE_INFINITY, normalized.getLowerBound()),
                    () -> assertEquals(-2.0, normalized.getUpperBound()),
                    () -> assertEquals(Map.of(y, -1.0), normalized.getLinearCoefficients()),
                    () -> assertEquals(Map.of(QuadraticTermKey.of(x, x), 1.0), normalized.getQuadraticCoefficients())
            );
        }

        @Test
        @DisplayName("线性约束也可以按二次规范化")
        void testLinearAsQuadratic() {
            NormalizedQuadraticInequality normalized = InequalityNormalizer.normalizeQuadratic(x.plus(1.0).ge(2.0));

            assertEquals(1.0, normalized.getLowerBound());
            assertEquals(Map.of(x, 1.0), normalized.getLinearCoefficients());
        }
    }

    @Nested
    @DisplayName("非法输入")
    class InvalidInputTests {

        @Test
        @DisplayName("同时给出有界表达式和 lb/ub/expr 抛出 AmbiguousConstructionException")
        void testAmbiguous() {
            assertAll("Ambiguous",
                    () -> assertThrows(AmbiguousConstructionException.class,
                            () -> InequalityNormalizer.normalizeLinear(x.le(1.0), 0.0, null, null)),
                    () -> assertThrows(AmbiguousConstructionException.class,
                            () -> InequalityNormalizer.normalizeLinear(x.le(1.0), null, 2.0, null)),
                    () -> assertThrows(AmbiguousConstructionException.class,
                            () -> InequalityNormalizer.normalizeLinear(x.le(1.0), null, null, y)),
                    () -> assertThrows(AmbiguousConstructionException.class,
                            () -> InequalityNormalizer.normalizeQuadratic(x.times(x).le(1.0), null, null, y))
            );
        }

        @Test
        @DisplayName("常数项为无穷或 NaN 时抛出 InvalidBoundException")
        void testNonFiniteOffset() {
            assertAll("Non finite offset",
                    () -> assertThrows(InvalidBoundException.class,
                            () -> InequalityNormalizer.normalizeLinear(x.plus(Double.POSITIVE_INFINITY).le(1.0))),
                    () -> assertThrows(InvalidBoundException.class,
                            () -> InequalityNormalizer.normalizeLinear(null, 0.0, null,
                                    x.plus(Double.POSITIVE_INFINITY).plus(Double.NEGATIVE_INFINITY))),
                    () -> assertThrows(InvalidBoundException.class,
                            () -> InequalityNormalizer.normalizeQuadratic(x.times(x).minus(Double.POSITIVE_INFINITY).ge(0.0)))
            );
        }

        @Test
        @SuppressWarnings("deprecation")
        @DisplayName("不等于约束不受支持")
        void testNotEqual() {
            UnsupportedOperationException exception =
                    assertThrows(UnsupportedOperationException.class, () -> x.ne(y));
            assertEquals("!= constraints are not supported", exception.getMessage());
            assertThrows(UnsupportedOperationException.class, () -> x.times(x).ne(1.0));
        }
    }
}
