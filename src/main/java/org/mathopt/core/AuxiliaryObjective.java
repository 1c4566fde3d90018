package org.mathopt.core;

import lombok.Getter;
import org.mathopt.elemental.AttrKey;
import org.mathopt.elemental.BoolAttr1;
import org.mathopt.elemental.DoubleAttr1;
import org.mathopt.elemental.DoubleAttr2;
import org.mathopt.elemental.ElementType;
import org.mathopt.elemental.Elemental;
import org.mathopt.elemental.IntAttr1;
import org.mathopt.exceptions.TypeMismatchException;
import org.mathopt.expressions.LinearTerm;
import org.mathopt.expressions.QuadraticExpression;
import org.mathopt.expressions.QuadraticTerm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 多目标求解中的辅助目标。只支持线性表达式。
 */
public final class AuxiliaryObjective extends Objective implements Comparable<AuxiliaryObjective> {

    @Getter
    private final long id;

    AuxiliaryObjective(Elemental elemental, long id) {
        super(elemental);
        this.id = id;
    }

    @Override
    public String getName() {
        return elemental.getElementName(ElementType.AUXILIARY_OBJECTIVE, id);
    }

    @Override
    public boolean isMaximize() {
        return elemental.getAttr(BoolAttr1.AUX_OBJ_MAXIMIZE, AttrKey.of(id));
    }

    @Override
    public void setMaximize(boolean maximize) {
        elemental.setAttr(BoolAttr1.AUX_OBJ_MAXIMIZE, AttrKey.of(id), maximize);
    }

    @Override
    public double getOffset() {
        return elemental.getAttr(DoubleAttr1.AUX_OBJ_OFFSET, AttrKey.of(id));
    }

    @Override
    public void setOffset(double offset) {
        elemental.setAttr(DoubleAttr1.AUX_OBJ_OFFSET, AttrKey.of(id), offset);
    }

    @Override
    public long getPriority() {
        return elemental.getAttr(IntAttr1.AUX_OBJ_PRIORITY, AttrKey.of(id));
    }

    @Override
    public void setPriority(long priority) {
        elemental.setAttr(IntAttr1.AUX_OBJ_PRIORITY, AttrKey.of(id), priority);
    }

    @Override
    public double getLinearCoefficient(Variable variable) {
        Model.checkVariable(elemental, variable);
        return elemental.getAttr(DoubleAttr2.AUX_OBJ_LIN_COEF, AttrKey.of(id, variable.getId()));
    }

    @Override
    public void setLinearCoefficient(Variable variable, double coefficient) {
        Model.checkVariable(elemental, variable);
        elemental.setAttr(DoubleAttr2.AUX_OBJ_LIN_COEF, AttrKey.of(id, variable.getId()), coefficient);
    }

    @Override
    public List<LinearTerm> linearTerms() {
        List<LinearTerm> terms = new ArrayList<>();
        for (AttrKey key : elemental.slice(DoubleAttr2.AUX_OBJ_LIN_COEF, 0, id)) {
            terms.add(LinearTerm.of(new Variable(elemental, key.get(1)),
                    elemental.getAttr(DoubleAttr2.AUX_OBJ_LIN_COEF, key)));
        }
        return terms;
    }

    @Override
    public double getQuadraticCoefficient(Variable first, Variable second) {
        Model.checkVariable(elemental, first);
        Model.checkVariable(elemental, second);
        return 0.0;
    }

    /**
     * @throws TypeMismatchException 辅助目标不支持二次项。
     */
    @Override
    public void setQuadraticCoefficient(Variable first, Variable second, double coefficient) {
        throw new TypeMismatchException("Auxiliary objectives do not support quadratic terms");
    }

    @Override
    public List<QuadraticTerm> quadraticTerms() {
        return Collections.emptyList();
    }

    @Override
    public void clear() {
        for (AttrKey key : elemental.slice(DoubleAttr2.AUX_OBJ_LIN_COEF, 0, id)) {
            elemental.setAttr(DoubleAttr2.AUX_OBJ_LIN_COEF, key, 0.0);
        }
        setOffset(0.0);
    }

    @Override
    protected void checkExpression(QuadraticExpression expression) {
        if (!expression.getQuadraticTerms().isEmpty()) {
            throw new TypeMismatchException("Auxiliary objectives do not support quadratic terms: " + expression);
        }
        expression.getLinearTerms().keySet().forEach(variable -> Model.checkVariableExists(elemental, variable));
    }

    @Override
    public int compareTo(AuxiliaryObjective o) {
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
        AuxiliaryObjective that = (AuxiliaryObjective) o;
        return id == that.id && elemental == that.elemental;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(elemental), id);
    }

    @Override
    public String toString() {
        if (!elemental.elementExists(ElementType.AUXILIARY_OBJECTIVE, id)) {
            return "<deleted auxiliary objective " + id + ">";
        }
        String name = getName();
        return name.isEmpty() ? "auxiliary_objective_" + id : name;
    }
}
