package org.mathopt.expressions.bounded;

import lombok.Getter;
import org.mathopt.exceptions.TypeMismatchException;
import org.mathopt.expressions.ExpressionNode;

/**
 * 只有上界的表达式 {@code expression <= upperBound}。再给出下界即得到 {@link BoundedExpression}。
 */
@Getter
public final class UpperBoundedExpression<E extends ExpressionNode> implements BoundedTypes<E> {

    private final E expression;

    private final double upperBound;

    private UpperBoundedExpression(E expression, double upperBound) {
        if (expression == null) {
            throw new TypeMismatchException("Bounded expression requires a non-null expression");
        }
        this.expression = expression;
        this.upperBound = upperBound;
    }

    public static <E extends ExpressionNode> UpperBoundedExpression<E> of(E expression, double upperBound) {
        return new UpperBoundedExpression<>(expression, upperBound);
    }

    @Override
    public double getLowerBound() {
        return Double.NEGATIVE_INFINITY;
    }

    public BoundedExpression<E> ge(double lowerBound) {
        return BoundedExpression.of(lowerBound, expression, upperBound);
    }

    @Override
    public String toString() {
        return expression + " <= " + upperBound;
    }
}
