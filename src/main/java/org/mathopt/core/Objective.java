package org.mathopt.core;

import lombok.Getter;
import org.mathopt.elemental.Elemental;
import org.mathopt.expressions.ExpressionNode;
import org.mathopt.expressions.Flattener;
import org.mathopt.expressions.LinearExpression;
import org.mathopt.expressions.LinearTerm;
import org.mathopt.expressions.QuadraticExpression;
import org.mathopt.expressions.QuadraticTerm;
import org.mathopt.expressions.QuadraticTermKey;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 目标函数的公共接口。主目标可以是二次的，辅助目标只能是线性的。
 * 方向和优先级与表达式相互独立，{@link #clear()} 不会改变它们。
 */
public abstract class Objective {

    @Getter
    protected final Elemental elemental;

    protected Objective(Elemental elemental) {
        this.elemental = elemental;
    }

    public abstract String getName();

    public abstract boolean isMaximize();

    public abstract void setMaximize(boolean maximize);

    public abstract double getOffset();

    public abstract void setOffset(double offset);

    public abstract long getPriority();

    public abstract void setPriority(long priority);

    public abstract double getLinearCoefficient(Variable variable);

    public abstract void setLinearCoefficient(Variable variable, double coefficient);

    public abstract List<LinearTerm> linearTerms();

    public abstract double getQuadraticCoefficient(Variable first, Variable second);

    public abstract void setQuadraticCoefficient(Variable first, Variable second, double coefficient);

    public abstract List<QuadraticTerm> quadraticTerms();

    /**
     * 常数项和所有系数置零。
     */
    public abstract void clear();

    /**
     * 校验展平后的表达式能否写入本目标，不合法时抛出异常且不修改目标。
     */
    protected abstract void checkExpression(QuadraticExpression expression);

    public void setToExpression(ExpressionNode expression) {
        QuadraticExpression flat = Flattener.asFlatQuadraticExpression(expression);
        checkExpression(flat);
        clear();
        addFlat(flat);
    }

    /**
     * 把表达式加到当前目标上。
     */
    public void add(ExpressionNode expression) {
        QuadraticExpression flat = Flattener.asFlatQuadraticExpression(expression);
        checkExpression(flat);
        addFlat(flat);
    }

    private void addFlat(QuadraticExpression flat) {
        setOffset(getOffset() + flat.getOffset());
        for (Map.Entry<Variable, Double> term : flat.getLinearTerms().entrySet()) {
            Variable variable = term.getKey();
            setLinearCoefficient(variable, getLinearCoefficient(variable) + term.getValue());
        }
        for (Map.Entry<QuadraticTermKey, Double> term : flat.getQuadraticTerms().entrySet()) {
            Variable first = term.getKey().getFirst();
            Variable second = term.getKey().getSecond();
            setQuadraticCoefficient(first, second, getQuadraticCoefficient(first, second) + term.getValue());
        }
    }

    /**
     * @throws IllegalStateException 目标含有二次项。
     */
    public LinearExpression asLinearExpression() {
        if (!quadraticTerms().isEmpty()) {
            throw new IllegalStateException("Cannot get a quadratic objective as a linear expression");
        }
        Map<Variable, Double> terms = new HashMap<>();
        for (LinearTerm term : linearTerms()) {
            terms.put(term.getVariable(), term.getCoefficient());
        }
        return LinearExpression.of(terms, getOffset());
    }

    public QuadraticExpression asQuadraticExpression() {
        Map<Variable, Double> linear = new HashMap<>();
        for (LinearTerm term : linearTerms()) {
            linear.put(term.getVariable(), term.getCoefficient());
        }
        Map<QuadraticTermKey, Double> quadratic = new HashMap<>();
        for (QuadraticTerm term : quadraticTerms()) {
            quadratic.put(term.getKey(), term.getCoefficient());
        }
        return QuadraticExpression.of(quadratic, linear, getOffset());
    }
}
