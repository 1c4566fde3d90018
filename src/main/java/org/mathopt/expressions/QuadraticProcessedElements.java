package org.mathopt.expressions;

import java.util.HashMap;
import java.util.Map;

/**
 * 二次展平的累加器，在线性部分之外累加二次项系数。
 */
public class QuadraticProcessedElements extends ProcessedElements {

    private final Map<QuadraticTermKey, Double> quadraticTerms = new HashMap<>();

    public void addQuadraticTerm(QuadraticTermKey key, double coefficient) {
        checkModel(key.getFirst());
        quadraticTerms.merge(key, coefficient, Double::sum);
    }

    public QuadraticExpression toQuadraticExpression() {
        return QuadraticExpression.of(quadraticTerms, getTerms(), getOffset());
    }
}
