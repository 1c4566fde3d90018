package org.mathopt.expressions.bounded;

import lombok.Getter;
import org.mathopt.exceptions.TypeMismatchException;
import org.mathopt.expressions.ExpressionNode;

/**
 * 两侧有界的表达式 {@code lowerBound <= expression <= upperBound}。
 * @author Ayalyt
 */
@Getter
public final class BoundedExpression<E extends ExpressionNode> implements BoundedTypes<E> {

    private final double lowerBound;

    private final E expression;

    private final double upperBound;

    private BoundedExpression(double lowerBound, E expression, double upperBound) {
        if (expression == null) {
            throw new TypeMismatchException("Bounded expression requires a non-null expression");
        }
        this.lowerBound = lowerBound;
        this.expression = expression;
        this.upperBound = upperBound;
    }

    public static <E extends ExpressionNode> BoundedExpression<E> of(double lowerBound, E expression, double upperBound) {
        return new BoundedExpression<>(lowerBound, expression, upperBound);
    }

    /**
     * {@code lowerBound <= expression <= upperBound} 的一步写法。
     */
    public static <E extends ExpressionNode> BoundedExpression<E> between(double lowerBound, E expression, double upperBound) {
        return new BoundedExpression<>(lowerBound, expression, upperBound);
    }

    @Override
    public String toString() {
        return lowerBound + " <= " + expression + " <= " + upperBound;
    }
}
