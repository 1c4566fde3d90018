package org.mathopt.expressions;

import lombok.Getter;
import org.mathopt.core.Variable;

import java.util.Objects;

/**
 * 单项 {@code coefficient * variable}。
 */
@Getter
public final class LinearTerm extends LinearBase {

    private final Variable variable;

    private final double coefficient;

    private LinearTerm(Variable variable, double coefficient) {
        this.variable = Objects.requireNonNull(variable, "LinearTerm: variable 不能为 null");
        this.coefficient = coefficient;
    }

    public static LinearTerm of(Variable variable, double coefficient) {
        return new LinearTerm(variable, coefficient);
    }

    @Override
    protected void flattenOnceAndAddTo(double scale, ProcessedElements processed,
                                       ToProcessElements<? super LinearBase> queue) {
        processed.addTerm(variable, scale * coefficient);
    }

    @Override
    public LinearBase times(double scalar) {
        return new LinearTerm(variable, coefficient * scalar);
    }

    @Override
    public LinearBase negate() {
        return new LinearTerm(variable, -coefficient);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearTerm that = (LinearTerm) o;
        return coefficient == that.coefficient && variable.equals(that.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, coefficient + 0.0);
    }

    @Override
    public String toString() {
        return coefficient + " * " + variable;
    }
}
