package org.mathopt.core;

import lombok.Getter;
import org.mathopt.elemental.AttrKey;
import org.mathopt.elemental.DoubleAttr1;
import org.mathopt.elemental.DoubleAttr2;
import org.mathopt.elemental.ElementType;
import org.mathopt.elemental.Elemental;
import org.mathopt.expressions.LinearBase;
import org.mathopt.expressions.LinearExpression;
import org.mathopt.expressions.LinearTerm;
import org.mathopt.expressions.bounded.BoundedExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 线性约束 {@code lb <= Σ a_i x_i <= ub} 的句柄。界和系数都可以在创建后修改。
 */
public final class LinearConstraint implements Comparable<LinearConstraint> {

    @Getter
    private final Elemental elemental;

    @Getter
    private final long id;

    LinearConstraint(Elemental elemental, long id) {
        this.elemental = elemental;
        this.id = id;
    }

    public String getName() {
        return elemental.getElementName(ElementType.LINEAR_CONSTRAINT, id);
    }

    public double getLowerBound() {
        return elemental.getAttr(DoubleAttr1.LIN_CON_LB, AttrKey.of(id));
    }

    public void setLowerBound(double lowerBound) {
        elemental.setAttr(DoubleAttr1.LIN_CON_LB, AttrKey.of(id), lowerBound);
    }

    public double getUpperBound() {
        return elemental.getAttr(DoubleAttr1.LIN_CON_UB, AttrKey.of(id));
    }

    public void setUpperBound(double upperBound) {
        elemental.setAttr(DoubleAttr1.LIN_CON_UB, AttrKey.of(id), upperBound);
    }

    public double getCoefficient(Variable variable) {
        Model.checkVariable(elemental, variable);
        return elemental.getAttr(DoubleAttr2.LIN_CON_COEF, AttrKey.of(id, variable.getId()));
    }

    public void setCoefficient(Variable variable, double coefficient) {
        Model.checkVariable(elemental, variable);
        elemental.setAttr(DoubleAttr2.LIN_CON_COEF, AttrKey.of(id, variable.getId()), coefficient);
    }

    /**
     * @return 非零系数的项，按变量 id 升序。
     */
    public List<LinearTerm> terms() {
        List<LinearTerm> terms = new ArrayList<>();
        for (AttrKey key : elemental.slice(DoubleAttr2.LIN_CON_COEF, 0, id)) {
            terms.add(LinearTerm.of(new Variable(elemental, key.get(1)),
                    elemental.getAttr(DoubleAttr2.LIN_CON_COEF, key)));
        }
        return terms;
    }

    public BoundedExpression<LinearBase> asBoundedLinearExpression() {
        SortedMap<Variable, Double> coefficients = new TreeMap<>();
        for (LinearTerm term : terms()) {
            coefficients.put(term.getVariable(), term.getCoefficient());
        }
        return BoundedExpression.of(getLowerBound(), LinearExpression.of(coefficients), getUpperBound());
    }

    @Override
    public int compareTo(LinearConstraint o) {
        return Long.compare(id, o.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearConstraint that = (LinearConstraint) o;
        return id == that.id && elemental == that.elemental;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(elemental), id);
    }

    @Override
    public String toString() {
        if (!elemental.elementExists(ElementType.LINEAR_CONSTRAINT, id)) {
            return "<deleted linear constraint " + id + ">";
        }
        String name = getName();
        return name.isEmpty() ? "linear_constraint_" + id : name;
    }
}
