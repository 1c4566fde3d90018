package org.mathopt.core;

import lombok.Getter;
import org.mathopt.elemental.AttrKey;
import org.mathopt.elemental.BoolAttr1;
import org.mathopt.elemental.DoubleAttr1;
import org.mathopt.elemental.DoubleAttr2;
import org.mathopt.elemental.ElementType;
import org.mathopt.elemental.Elemental;
import org.mathopt.elemental.VariableAttr1;
import org.mathopt.expressions.LinearBase;
import org.mathopt.expressions.LinearExpression;
import org.mathopt.expressions.LinearTerm;
import org.mathopt.expressions.bounded.BoundedExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 指示约束：当指示变量取 1 (或 activateOnZero 时取 0) 时，
 * 蕴含的线性约束 {@code lb <= Σ a_i x_i <= ub} 必须成立。创建后只读。
 * 指示变量被删除后，指示变量变为未设置。
 */
public final class IndicatorConstraint implements Comparable<IndicatorConstraint> {

    @Getter
    private final Elemental elemental;

    @Getter
    private final long id;

    IndicatorConstraint(Elemental elemental, long id) {
        this.elemental = elemental;
        this.id = id;
    }

    public String getName() {
        return elemental.getElementName(ElementType.INDICATOR_CONSTRAINT, id);
    }

    public Optional<Variable> getIndicator() {
        long indicator = elemental.getAttr(VariableAttr1.IND_CON_INDICATOR, AttrKey.of(id));
        return indicator == VariableAttr1.UNSET ? Optional.empty() : Optional.of(new Variable(elemental, indicator));
    }

    public boolean isActivateOnZero() {
        return elemental.getAttr(BoolAttr1.IND_CON_ACTIVATE_ON_ZERO, AttrKey.of(id));
    }

    public double getLowerBound() {
        return elemental.getAttr(DoubleAttr1.IND_CON_LB, AttrKey.of(id));
    }

    public double getUpperBound() {
        return elemental.getAttr(DoubleAttr1.IND_CON_UB, AttrKey.of(id));
    }

    public double getCoefficient(Variable variable) {
        Model.checkVariable(elemental, variable);
        return elemental.getAttr(DoubleAttr2.IND_CON_LIN_COEF, AttrKey.of(id, variable.getId()));
    }

    public List<LinearTerm> terms() {
        List<LinearTerm> terms = new ArrayList<>();
        for (AttrKey key : elemental.slice(DoubleAttr2.IND_CON_LIN_COEF, 0, id)) {
            terms.add(LinearTerm.of(new Variable(elemental, key.get(1)),
                    elemental.getAttr(DoubleAttr2.IND_CON_LIN_COEF, key)));
        }
        return terms;
    }

    public BoundedExpression<LinearBase> getImpliedConstraint() {
        SortedMap<Variable, Double> coefficients = new TreeMap<>();
        for (LinearTerm term : terms()) {
            coefficients.put(term.getVariable(), term.getCoefficient());
        }
        return BoundedExpression.of(getLowerBound(), LinearExpression.of(coefficients), getUpperBound());
    }

    @Override
    public int compareTo(IndicatorConstraint o) {
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
        IndicatorConstraint that = (IndicatorConstraint) o;
        return id == that.id && elemental == that.elemental;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(elemental), id);
    }

    @Override
    public String toString() {
        if (!elemental.elementExists(ElementType.INDICATOR_CONSTRAINT, id)) {
            return "<deleted indicator constraint " + id + ">";
        }
        String name = getName();
        return name.isEmpty() ? "indicator_constraint_" + id : name;
    }
}
