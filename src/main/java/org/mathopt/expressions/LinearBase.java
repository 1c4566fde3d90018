package org.mathopt.expressions;

import org.mathopt.exceptions.TypeMismatchException;
import org.mathopt.expressions.bounded.BoundedExpression;
import org.mathopt.expressions.bounded.BoundedTypes;
import org.mathopt.expressions.bounded.LowerBoundedExpression;
import org.mathopt.expressions.bounded.UpperBoundedExpression;

/**
 * 线性表达式树节点的基类。算术方法只构造新的节点，不做任何计算；
 * 规范形式由 {@link Flattener#asFlatLinearExpression(LinearBase)} 按需得到。
 * <p>
 * 比较方法返回有界表达式，而不是布尔值。
 */
public abstract class LinearBase implements ExpressionNode {

    /**
     * 线性展平一层。
     */
    protected abstract void flattenOnceAndAddTo(double scale, ProcessedElements processed,
                                                ToProcessElements<? super LinearBase> queue);

    @Override
    public void quadraticFlattenOnceAndAddTo(double scale, QuadraticProcessedElements processed,
                                             ToProcessElements<ExpressionNode> queue) {
        flattenOnceAndAddTo(scale, processed, queue);
    }

    // --- 算术 ---

    public LinearBase plus(double constant) {
        return LinearSum.of(this, LinearConstant.of(constant));
    }

    public LinearBase plus(LinearBase other) {
        return LinearSum.of(this, checkOperand(other));
    }

    public QuadraticBase plus(QuadraticBase other) {
        return QuadraticSum.of(this, checkOperand(other));
    }

    public LinearBase minus(double constant) {
        return LinearSum.of(this, LinearConstant.of(-constant));
    }

    public LinearBase minus(LinearBase other) {
        return LinearSum.of(this, checkOperand(other).negate());
    }

    public QuadraticBase minus(QuadraticBase other) {
        return QuadraticSum.of(this, checkOperand(other).negate());
    }

    public LinearBase times(double scalar) {
        return LinearProduct.of(scalar, this);
    }

    /**
     * 线性乘线性得到二次表达式。二次表达式不能再与线性表达式相乘。
     */
    public QuadraticBase times(LinearBase other) {
        return LinearLinearProduct.of(this, checkOperand(other));
    }

    public LinearBase dividedBy(double scalar) {
        if (scalar == 0.0) {
            throw new ArithmeticException("Division of a linear expression by zero");
        }
        return LinearProduct.of(1.0 / scalar, this);
    }

    public LinearBase negate() {
        return LinearProduct.of(-1.0, this);
    }

    // --- 比较 ---

    public UpperBoundedExpression<LinearBase> le(double rhs) {
        return UpperBoundedExpression.of(this, rhs);
    }

    public LowerBoundedExpression<LinearBase> ge(double rhs) {
        return LowerBoundedExpression.of(this, rhs);
    }

    public BoundedExpression<LinearBase> eq(double rhs) {
        return BoundedExpression.of(rhs, this, rhs);
    }

    public BoundedExpression<LinearBase> le(LinearBase rhs) {
        return BoundedExpression.of(Double.NEGATIVE_INFINITY, minus(rhs), 0.0);
    }

    public BoundedExpression<LinearBase> ge(LinearBase rhs) {
        return BoundedExpression.of(0.0, minus(rhs), Double.POSITIVE_INFINITY);
    }

    public BoundedExpression<LinearBase> eq(LinearBase rhs) {
        return BoundedExpression.of(0.0, minus(rhs), 0.0);
    }

    public BoundedExpression<QuadraticBase> le(QuadraticBase rhs) {
        return BoundedExpression.of(Double.NEGATIVE_INFINITY, minus(rhs), 0.0);
    }

    public BoundedExpression<QuadraticBase> ge(QuadraticBase rhs) {
        return BoundedExpression.of(0.0, minus(rhs), Double.POSITIVE_INFINITY);
    }

    public BoundedExpression<QuadraticBase> eq(QuadraticBase rhs) {
        return BoundedExpression.of(0.0, minus(rhs), 0.0);
    }

    /**
     * 不支持不等于约束。
     * @throws UnsupportedOperationException 总是抛出。
     */
    @Deprecated
    public BoundedTypes<LinearBase> ne(Object other) {
        throw new UnsupportedOperationException("!= constraints are not supported");
    }

    static <T> T checkOperand(T operand) {
        if (operand == null) {
            throw new TypeMismatchException("Unsupported operand: null");
        }
        return operand;
    }
}
