package org.mathopt.expressions.bounded;

import lombok.Getter;
import org.mathopt.core.Variable;
import org.mathopt.expressions.LinearBase;

import java.util.Objects;

/**
 * 两个变量相等 {@code first == second}，等价于 {@code 0 <= first - second <= 0}。
 */
@Getter
public final class VarEqVar implements BoundedTypes<LinearBase> {

    private final Variable firstVariable;

    private final Variable secondVariable;

    private VarEqVar(Variable firstVariable, Variable secondVariable) {
        this.firstVariable = Objects.requireNonNull(firstVariable, "VarEqVar: firstVariable 不能为 null");
        this.secondVariable = Objects.requireNonNull(secondVariable, "VarEqVar: secondVariable 不能为 null");
    }

    public static VarEqVar of(Variable firstVariable, Variable secondVariable) {
        return new VarEqVar(firstVariable, secondVariable);
    }

    @Override
    public double getLowerBound() {
        return 0.0;
    }

    @Override
    public double getUpperBound() {
        return 0.0;
    }

    @Override
    public LinearBase getExpression() {
        return firstVariable.minus(secondVariable);
    }

    @Override
    public String toString() {
        return firstVariable + " == " + secondVariable;
    }
}
