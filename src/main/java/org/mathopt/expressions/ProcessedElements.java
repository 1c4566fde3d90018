package org.mathopt.expressions;

import org.mathopt.core.Variable;
import org.mathopt.elemental.Elemental;
import org.mathopt.exceptions.TypeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 线性展平的累加器：常数项和每个变量的系数。所有变量必须来自同一个模型。
 */
public class ProcessedElements {

    private static final Logger logger = LoggerFactory.getLogger(ProcessedElements.class);

    private final Map<Variable, Double> terms = new HashMap<>();

    private double offset;

    private Elemental elemental;

    public void addOffset(double value) {
        offset += value;
    }

    public void addTerm(Variable variable, double coefficient) {
        checkModel(variable);
        terms.merge(variable, coefficient, Double::sum);
    }

    protected void checkModel(Variable variable) {
        if (elemental == null) {
            elemental = variable.getElemental();
        } else if (elemental != variable.getElemental()) {
            logger.error("表达式混用了来自不同模型的变量: {} 与 {}", elemental, variable.getElemental());
            throw new TypeMismatchException("Expression mixes variables from different models: " + variable);
        }
    }

    protected double getOffset() {
        return offset;
    }

    protected Map<Variable, Double> getTerms() {
        return terms;
    }

    public LinearExpression toLinearExpression() {
        return LinearExpression.of(terms, offset);
    }
}
