package org.mathopt.expressions.bounded;

import org.mathopt.exceptions.AmbiguousConstructionException;
import org.mathopt.exceptions.InvalidBoundException;
import org.mathopt.expressions.ExpressionNode;
import org.mathopt.expressions.Flattener;
import org.mathopt.expressions.LinearBase;
import org.mathopt.expressions.LinearExpression;
import org.mathopt.expressions.QuadraticExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

/**
 * 把约束的两种写法统一为 {@code lb <= Σ ... <= ub}：
 * 要么给出一个有界表达式，要么分别给出 lb、ub、expr (缺省为 -∞、+∞、0)，二者不可同时使用。
 * 表达式展平后的常数项从两侧界中减去。
 * @author Ayalyt
 */
public final class InequalityNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(InequalityNormalizer.class);

    private InequalityNormalizer() {
    }

    /**
     * @param bounded 有界表达式，可为 null。
     * @param lb      下界，可为 null。
     * @param ub      上界，可为 null。
     * @param expr    表达式，可为 null。
     * @throws AmbiguousConstructionException 同时给出了 bounded 和 lb/ub/expr 中的任意一项。
     * @throws InvalidBoundException          表达式的常数项不是有限值。
     */
    public static NormalizedLinearInequality normalizeLinear(BoundedTypes<? extends LinearBase> bounded,
                                                             Double lb, Double ub, LinearBase expr) {
        double lowerBound;
        double upperBound;
        LinearExpression flat;
        if (bounded != null) {
            checkUnambiguous(lb, ub, expr);
            lowerBound = bounded.getLowerBound();
            upperBound = bounded.getUpperBound();
            flat = Flattener.asFlatLinearExpression(bounded.getExpression());
        } else {
            lowerBound = lb == null ? Double.NEGATIVE_INFINITY : lb;
            upperBound = ub == null ? Double.POSITIVE_INFINITY : ub;
            flat = expr == null ? LinearExpression.constant(0.0) : Flattener.asFlatLinearExpression(expr);
        }
        double offset = checkOffset(flat.getOffset());
        return NormalizedLinearInequality.of(lowerBound - offset, upperBound - offset, flat.getTerms());
    }

    public static NormalizedLinearInequality normalizeLinear(BoundedTypes<? extends LinearBase> bounded) {
        return normalizeLinear(bounded, null, null, null);
    }

    /**
     * 二次版本，规则与 {@link #normalizeLinear(BoundedTypes, Double, Double, LinearBase)} 相同。
     */
    public static NormalizedQuadraticInequality normalizeQuadratic(BoundedTypes<? extends ExpressionNode> bounded,
                                                                   Double lb, Double ub, ExpressionNode expr) {
        double lowerBound;
        double upperBound;
        QuadraticExpression flat;
        if (bounded != null) {
            checkUnambiguous(lb, ub, expr);
            lowerBound = bounded.getLowerBound();
            upperBound = bounded.getUpperBound();
            flat = Flattener.asFlatQuadraticExpression(bounded.getExpression());
        } else {
            lowerBound = lb == null ? Double.NEGATIVE_INFINITY : lb;
            upperBound = ub == null ? Double.POSITIVE_INFINITY : ub;
            flat = expr == null
                    ? QuadraticExpression.of(Collections.emptyMap(), Collections.emptyMap(), 0.0)
                    : Flattener.asFlatQuadraticExpression(expr);
        }
        double offset = checkOffset(flat.getOffset());
        return NormalizedQuadraticInequality.of(lowerBound - offset, upperBound - offset,
                flat.getLinearTerms(), flat.getQuadraticTerms());
    }

    public static NormalizedQuadraticInequality normalizeQuadratic(BoundedTypes<? extends ExpressionNode> bounded) {
        return normalizeQuadratic(bounded, null, null, null);
    }

    private static void checkUnambiguous(Double lb, Double ub, Object expr) {
        if (lb != null || ub != null || expr != null) {
            logger.error("约束同时给出了有界表达式和 lb/ub/expr: lb={}, ub={}, expr={}", lb, ub, expr);
            throw new AmbiguousConstructionException(
                    "Cannot specify a bounded expression together with any of lb, ub or expr");
        }
    }

    private static double checkOffset(double offset) {
        if (!Double.isFinite(offset)) {
            logger.error("表达式的常数项不是有限值: {}", offset);
            throw new InvalidBoundException("Expression offset must be finite, got " + offset);
        }
        return offset;
    }
}
