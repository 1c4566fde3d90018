package org.mathopt.core;

import lombok.Getter;
import org.mathopt.elemental.AttrKey;
import org.mathopt.elemental.DoubleAttr1;
import org.mathopt.elemental.DoubleAttr2;
import org.mathopt.elemental.ElementType;
import org.mathopt.elemental.Elemental;
import org.mathopt.elemental.SymmetricDoubleAttr3;
import org.mathopt.expressions.LinearTerm;
import org.mathopt.expressions.QuadraticBase;
import org.mathopt.expressions.QuadraticExpression;
import org.mathopt.expressions.QuadraticTerm;
import org.mathopt.expressions.QuadraticTermKey;
import org.mathopt.expressions.bounded.BoundedExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 二次约束的句柄。创建后只读。
 */
public final class QuadraticConstraint implements Comparable<QuadraticConstraint> {

    @Getter
    private final Elemental elemental;

    @Getter
    private final long id;

    QuadraticConstraint(Elemental elemental, long id) {
        this.elemental = elemental;
        this.id = id;
    }

    public String getName() {
        return elemental.getElementName(ElementType.QUADRATIC_CONSTRAINT, id);
    }

    public double getLowerBound() {
        return elemental.getAttr(DoubleAttr1.QUAD_CON_LB, AttrKey.of(id));
    }

    public double getUpperBound() {
        return elemental.getAttr(DoubleAttr1.QUAD_CON_UB, AttrKey.of(id));
    }

    public double getLinearCoefficient(Variable variable) {
        Model.checkVariable(elemental, variable);
        return elemental.getAttr(DoubleAttr2.QUAD_CON_LIN_COEF, AttrKey.of(id, variable.getId()));
    }

    public double getQuadraticCoefficient(Variable first, Variable second) {
        Model.checkVariable(elemental, first);
        Model.checkVariable(elemental, second);
        return elemental.getAttr(SymmetricDoubleAttr3.QUAD_CON_QUAD_COEF,
                AttrKey.of(id, first.getId(), second.getId()));
    }

    public List<LinearTerm> linearTerms() {
        List<LinearTerm> terms = new ArrayList<>();
        for (AttrKey key : elemental.slice(DoubleAttr2.QUAD_CON_LIN_COEF, 0, id)) {
            terms.add(LinearTerm.of(new Variable(elemental, key.get(1)),
                    elemental.getAttr(DoubleAttr2.QUAD_CON_LIN_COEF, key)));
        }
        return terms;
    }

    public List<QuadraticTerm> quadraticTerms() {
        List<QuadraticTerm> terms = new ArrayList<>();
        for (AttrKey key : elemental.slice(SymmetricDoubleAttr3.QUAD_CON_QUAD_COEF, 0, id)) {
            QuadraticTermKey termKey = QuadraticTermKey.of(
                    new Variable(elemental, key.get(1)), new Variable(elemental, key.get(2)));
            terms.add(QuadraticTerm.of(termKey, elemental.getAttr(SymmetricDoubleAttr3.QUAD_CON_QUAD_COEF, key)));
        }
        return terms;
    }

    public BoundedExpression<QuadraticBase> asBoundedQuadraticExpression() {
        Map<Variable, Double> linear = new TreeMap<>();
        for (LinearTerm term : linearTerms()) {
            linear.put(term.getVariable(), term.getCoefficient());
        }
        Map<QuadraticTermKey, Double> quadratic = new TreeMap<>();
        for (QuadraticTerm term : quadraticTerms()) {
            quadratic.put(term.getKey(), term.getCoefficient());
        }
        return BoundedExpression.of(getLowerBound(), QuadraticExpression.of(quadratic, linear, 0.0), getUpperBound());
    }

    @Override
    public int compareTo(QuadraticConstraint o) {
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
        QuadraticConstraint that = (QuadraticConstraint) o;
        return id == that.id && elemental == that.elemental;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(elemental), id);
    }

    @Override
    public String toString() {
        if (!elemental.elementExists(ElementType.QUADRATIC_CONSTRAINT, id)) {
            return "<deleted quadratic constraint " + id + ">";
        }
        String name = getName();
        return name.isEmpty() ? "quadratic_constraint_" + id : name;
    }
}
