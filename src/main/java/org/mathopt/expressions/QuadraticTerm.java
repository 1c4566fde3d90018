package org.mathopt.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * 二次单项 {@code coefficient * first * second}。
 */
@Getter
public final class QuadraticTerm extends QuadraticBase {

    private final QuadraticTermKey key;

    private final double coefficient;

    private QuadraticTerm(QuadraticTermKey key, double coefficient) {
        this.key = Objects.requireNonNull(key, "QuadraticTerm: key 不能为 null");
        this.coefficient = coefficient;
    }

    public static QuadraticTerm of(QuadraticTermKey key, double coefficient) {
        return new QuadraticTerm(key, coefficient);
    }

    @Override
    public void quadraticFlattenOnceAndAddTo(double scale, QuadraticProcessedElements processed,
                                             ToProcessElements<ExpressionNode> queue) {
        processed.addQuadraticTerm(key, scale * coefficient);
    }

    @Override
    public QuadraticBase times(double scalar) {
        return new QuadraticTerm(key, coefficient * scalar);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QuadraticTerm that = (QuadraticTerm) o;
        return coefficient == that.coefficient && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, coefficient + 0.0);
    }

    @Override
    public String toString() {
        return coefficient + " * " + key;
    }
}
