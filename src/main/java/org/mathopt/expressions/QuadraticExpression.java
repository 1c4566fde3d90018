package org.mathopt.expressions;

import lombok.Getter;
import org.mathopt.core.Variable;
import org.mathopt.core.VariableValuation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 二次表达式的规范形式 {@code offset + Σ c_i x_i + Σ q_ij x_i x_j}，
 * 恰好为 0.0 的系数被删除。此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class QuadraticExpression extends QuadraticBase {

    private static final Logger logger = LoggerFactory.getLogger(QuadraticExpression.class);

    private final SortedMap<QuadraticTermKey, Double> quadraticTerms;

    private final SortedMap<Variable, Double> linearTerms;

    private final double offset;

    private final int hashCode;

    private QuadraticExpression(Map<QuadraticTermKey, Double> quadraticTerms,
                                Map<Variable, Double> linearTerms, double offset) {
        LinearExpression linear = LinearExpression.of(linearTerms, offset);
        SortedMap<QuadraticTermKey, Double> nonZero = new TreeMap<>();
        for (Map.Entry<QuadraticTermKey, Double> entry : Objects.requireNonNull(quadraticTerms, "QuadraticExpression: quadraticTerms 不能为 null").entrySet()) {
            double coefficient = Objects.requireNonNull(entry.getValue(), "QuadraticExpression: 系数不能为 null");
            if (coefficient != 0.0) {
                nonZero.put(Objects.requireNonNull(entry.getKey(), "QuadraticExpression: 键不能为 null"), coefficient);
            }
        }
        this.quadraticTerms = Collections.unmodifiableSortedMap(nonZero);
        this.linearTerms = linear.getTerms();
        this.offset = offset;
        this.hashCode = Objects.hash(this.quadraticTerms, this.linearTerms, offset + 0.0);
        logger.debug("创建 QuadraticExpression: {}", this);
    }

    public static QuadraticExpression of(Map<QuadraticTermKey, Double> quadraticTerms,
                                         Map<Variable, Double> linearTerms, double offset) {
        return new QuadraticExpression(quadraticTerms, linearTerms, offset);
    }

    public double getLinearCoefficient(Variable variable) {
        return linearTerms.getOrDefault(variable, 0.0);
    }

    public double getQuadraticCoefficient(Variable first, Variable second) {
        return quadraticTerms.getOrDefault(QuadraticTermKey.of(first, second), 0.0);
    }

    @Override
    public void quadraticFlattenOnceAndAddTo(double scale, QuadraticProcessedElements processed,
                                             ToProcessElements<ExpressionNode> queue) {
        processed.addOffset(scale * offset);
        for (Map.Entry<Variable, Double> entry : linearTerms.entrySet()) {
            processed.addTerm(entry.getKey(), scale * entry.getValue());
        }
        for (Map.Entry<QuadraticTermKey, Double> entry : quadraticTerms.entrySet()) {
            processed.addQuadraticTerm(entry.getKey(), scale * entry.getValue());
        }
    }

    public double evaluate(VariableValuation valuation) {
        double result = offset;
        for (Map.Entry<Variable, Double> entry : linearTerms.entrySet()) {
            result += entry.getValue() * valuation.getValue(entry.getKey());
        }
        for (Map.Entry<QuadraticTermKey, Double> entry : quadraticTerms.entrySet()) {
            QuadraticTermKey key = entry.getKey();
            result += entry.getValue() * valuation.getValue(key.getFirst()) * valuation.getValue(key.getSecond());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QuadraticExpression that = (QuadraticExpression) o;
        return offset == that.offset
                && linearTerms.equals(that.linearTerms)
                && quadraticTerms.equals(that.quadraticTerms);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(offset);
        for (Map.Entry<Variable, Double> entry : linearTerms.entrySet()) {
            sb.append(" + ").append(entry.getValue()).append(" * ").append(entry.getKey());
        }
        for (Map.Entry<QuadraticTermKey, Double> entry : quadraticTerms.entrySet()) {
            sb.append(" + ").append(entry.getValue()).append(" * ").append(entry.getKey());
        }
        return sb.toString();
    }
}
