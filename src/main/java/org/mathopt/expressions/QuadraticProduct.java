package org.mathopt.expressions;

import lombok.Getter;

import static org.mathopt.expressions.LinearBase.checkOperand;

/**
 * 标量乘二次表达式。
 */
@Getter
public final class QuadraticProduct extends QuadraticBase {

    private final double scalar;

    private final QuadraticBase quadratic;

    private QuadraticProduct(double scalar, QuadraticBase quadratic) {
        this.scalar = scalar;
        this.quadratic = quadratic;
    }

    public static QuadraticProduct of(double scalar, QuadraticBase quadratic) {
        return new QuadraticProduct(scalar, checkOperand(quadratic));
    }

    @Override
    public void quadraticFlattenOnceAndAddTo(double scale, QuadraticProcessedElements processed,
                                             ToProcessElements<ExpressionNode> queue) {
        queue.append(quadratic, scale * scalar);
    }

    @Override
    public String toString() {
        return scalar + " * " + quadratic;
    }
}
