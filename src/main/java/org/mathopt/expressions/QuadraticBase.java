package org.mathopt.expressions;

import org.mathopt.expressions.bounded.BoundedExpression;
import org.mathopt.expressions.bounded.BoundedTypes;
import org.mathopt.expressions.bounded.LowerBoundedExpression;
import org.mathopt.expressions.bounded.UpperBoundedExpression;

import static org.mathopt.expressions.LinearBase.checkOperand;

/**
 * 二次表达式树节点的基类。与线性表达式相加得到二次表达式；只能与标量相乘。
 */
public abstract class QuadraticBase implements ExpressionNode {

    public QuadraticBase plus(double constant) {
        return QuadraticSum.of(this, LinearConstant.of(constant));
    }

    public QuadraticBase plus(ExpressionNode other) {
        return QuadraticSum.of(this, checkOperand(other));
    }

    public QuadraticBase minus(double constant) {
        return QuadraticSum.of(this, LinearConstant.of(-constant));
    }

    public QuadraticBase minus(LinearBase other) {
        return QuadraticSum.of(this, checkOperand(other).negate());
    }

    public QuadraticBase minus(QuadraticBase other) {
        return QuadraticSum.of(this, checkOperand(other).negate());
    }

    public QuadraticBase times(double scalar) {
        return QuadraticProduct.of(scalar, this);
    }

    public QuadraticBase dividedBy(double scalar) {
        if (scalar == 0.0) {
            throw new ArithmeticException("Division of a quadratic expression by zero");
        }
        return QuadraticProduct.of(1.0 / scalar, this);
    }

    public QuadraticBase negate() {
        return QuadraticProduct.of(-1.0, this);
    }

    public UpperBoundedExpression<QuadraticBase> le(double rhs) {
        return UpperBoundedExpression.of(this, rhs);
    }

    public LowerBoundedExpression<QuadraticBase> ge(double rhs) {
        return LowerBoundedExpression.of(this, rhs);
    }

    public BoundedExpression<QuadraticBase> eq(double rhs) {
        return BoundedExpression.of(rhs, this, rhs);
    }

    public BoundedExpression<QuadraticBase> le(LinearBase rhs) {
        return BoundedExpression.of(Double.NEGATIVE_INFINITY, minus(rhs), 0.0);
    }

    public BoundedExpression<QuadraticBase> ge(LinearBase rhs) {
        return BoundedExpression.of(0.0, minus(rhs), Double.POSITIVE_INFINITY);
    }

    public BoundedExpression<QuadraticBase> eq(LinearBase rhs) {
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
     * @throws UnsupportedOperationException 总是抛出。
     */
    @Deprecated
    public BoundedTypes<QuadraticBase> ne(Object other) {
        throw new UnsupportedOperationException("!= constraints are not supported");
    }
}
