package org.mathopt.expressions.bounded;

import lombok.Getter;
import org.mathopt.exceptions.TypeMismatchException;
import org.mathopt.expressions.ExpressionNode;

/**
 * 只有下界的表达式 {@code expression >= lowerBound}。再给出上界即得到 {@link BoundedExpression}。
 */
@Getter
public final class LowerBoundedExpression<E extends ExpressionNode> implements BoundedTypes<E> {

    private final E expression;

    private final double lowerBound;

    private LowerBoundedExpression(E expression, double lowerBound) {
        if (expression == null) {
            throw new TypeMismatchException("Bounded expression requires a non-null expression");
        }
        this.expression = expression;
        this.lowerBound = lowerBound;
    }

    public static <E extends ExpressionNode> LowerBoundedExpression<E> of(E expression, double lowerBound) {
        return new LowerBoundedExpression<>(expression, lowerBound);
    }

    @Override
    public double getUpperBound() {
        return Double.POSITIVE_INFINITY;
    }

    public BoundedExpression<E> le(double upperBound) {
        return BoundedExpression.of(lowerBound, expression, upperBound);
    }

    @Override
    public String toString() {
        return expression + " >= " + lowerBound;
    }
}
