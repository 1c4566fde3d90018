package org.mathopt.core;

import org.mathopt.elemental.AttrKey;
import org.mathopt.elemental.BoolAttr0;
import org.mathopt.elemental.DoubleAttr0;
import org.mathopt.elemental.DoubleAttr1;
import org.mathopt.elemental.Elemental;
import org.mathopt.elemental.IntAttr0;
import org.mathopt.elemental.SymmetricDoubleAttr2;
import org.mathopt.expressions.LinearTerm;
import org.mathopt.expressions.QuadraticExpression;
import org.mathopt.expressions.QuadraticTerm;
import org.mathopt.expressions.QuadraticTermKey;

import java.util.ArrayList;
import java.util.List;

/**
 * 模型的主目标，每个模型恰有一个。
 * @author Ayalyt
 */
public final class PrimaryObjective extends Objective {

    PrimaryObjective(Elemental elemental) {
        super(elemental);
    }

    @Override
    public String getName() {
        return elemental.getPrimaryObjectiveName();
    }

    @Override
    public boolean isMaximize() {
        return elemental.getAttr(BoolAttr0.MAXIMIZE, AttrKey.EMPTY);
    }

    @Override
    public void setMaximize(boolean maximize) {
        elemental.setAttr(BoolAttr0.MAXIMIZE, AttrKey.EMPTY, maximize);
    }

    @Override
    public double getOffset() {
        return elemental.getAttr(DoubleAttr0.OBJ_OFFSET, AttrKey.EMPTY);
    }

    @Override
    public void setOffset(double offset) {
        elemental.setAttr(DoubleAttr0.OBJ_OFFSET, AttrKey.EMPTY, offset);
    }

    @Override
    public long getPriority() {
        return elemental.getAttr(IntAttr0.OBJ_PRIORITY, AttrKey.EMPTY);
    }

    @Override
    public void setPriority(long priority) {
        elemental.setAttr(IntAttr0.OBJ_PRIORITY, AttrKey.EMPTY, priority);
    }

    @Override
    public double getLinearCoefficient(Variable variable) {
        Model.checkVariable(elemental, variable);
        return elemental.getAttr(DoubleAttr1.OBJ_LIN_COEF, AttrKey.of(variable.getId()));
    }

    @Override
    public void setLinearCoefficient(Variable variable, double coefficient) {
        Model.checkVariable(elemental, variable);
        elemental.setAttr(DoubleAttr1.OBJ_LIN_COEF, AttrKey.of(variable.getId()), coefficient);
    }

    @Override
    public List<LinearTerm> linearTerms() {
        List<LinearTerm> terms = new ArrayList<>();
        for (AttrKey key : elemental.attrNonDefaults(DoubleAttr1.OBJ_LIN_COEF)) {
            terms.add(LinearTerm.of(new Variable(elemental, key.get(0)),
                    elemental.getAttr(DoubleAttr1.OBJ_LIN_COEF, key)));
        }
        return terms;
    }

    @Override
    public double getQuadraticCoefficient(Variable first, Variable second) {
        Model.checkVariable(elemental, first);
        Model.checkVariable(elemental, second);
        return elemental.getAttr(SymmetricDoubleAttr2.OBJ_QUAD_COEF, AttrKey.of(first.getId(), second.getId()));
    }

    @Override
    public void setQuadraticCoefficient(Variable first, Variable second, double coefficient) {
        Model.checkVariable(elemental, first);
        Model.checkVariable(elemental, second);
        elemental.setAttr(SymmetricDoubleAttr2.OBJ_QUAD_COEF, AttrKey.of(first.getId(), second.getId()), coefficient);
    }

    @Override
    public List<QuadraticTerm> quadraticTerms() {
        List<QuadraticTerm> terms = new ArrayList<>();
        for (AttrKey key : elemental.attrNonDefaults(SymmetricDoubleAttr2.OBJ_QUAD_COEF)) {
            QuadraticTermKey termKey = QuadraticTermKey.of(
                    new Variable(elemental, key.get(0)), new Variable(elemental, key.get(1)));
            terms.add(QuadraticTerm.of(termKey, elemental.getAttr(SymmetricDoubleAttr2.OBJ_QUAD_COEF, key)));
        }
        return terms;
    }

    @Override
    public void clear() {
        elemental.attrClear(DoubleAttr1.OBJ_LIN_COEF);
        elemental.attrClear(SymmetricDoubleAttr2.OBJ_QUAD_COEF);
        setOffset(0.0);
    }

    @Override
    protected void checkExpression(QuadraticExpression expression) {
        expression.getLinearTerms().keySet().forEach(variable -> Model.checkVariableExists(elemental, variable));
        expression.getQuadraticTerms().keySet().forEach(key -> {
            Model.checkVariableExists(elemental, key.getFirst());
            Model.checkVariableExists(elemental, key.getSecond());
        });
    }

    @Override
    public String toString() {
        return "PrimaryObjective{" + (isMaximize() ? "max " : "min ") + asQuadraticExpression() + "}";
    }
}
