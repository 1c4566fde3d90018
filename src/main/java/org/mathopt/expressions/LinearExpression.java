package org.mathopt.expressions;

import lombok.Getter;
import org.mathopt.core.Variable;
import org.mathopt.core.VariableValuation;
import org.mathopt.exceptions.TypeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 线性表达式的规范形式 {@code offset + Σ c_i * x_i}。变量唯一、按 id 升序，
 * 系数恰好为 0.0 的项被删除。此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class LinearExpression extends LinearBase {

    private static final Logger logger = LoggerFactory.getLogger(LinearExpression.class);

    private final SortedMap<Variable, Double> terms;

    private final double offset;

    private final int hashCode;

    private LinearExpression(Map<Variable, Double> terms, double offset) {
        SortedMap<Variable, Double> nonZero = new TreeMap<>();
        Variable reference = null;
        for (Map.Entry<Variable, Double> entry : Objects.requireNonNull(terms, "LinearExpression: terms 不能为 null").entrySet()) {
            Variable variable = Objects.requireNonNull(entry.getKey(), "LinearExpression: 变量不能为 null");
            double coefficient = Objects.requireNonNull(entry.getValue(), "LinearExpression: 系数不能为 null");
            if (reference == null) {
                reference = variable;
            } else if (reference.getElemental() != variable.getElemental()) {
                throw new TypeMismatchException("Expression mixes variables from different models: " + variable);
            }
            if (coefficient != 0.0) {
                nonZero.put(variable, coefficient);
            }
        }
        this.terms = Collections.unmodifiableSortedMap(nonZero);
        this.offset = offset;
        this.hashCode = Objects.hash(this.terms, offset + 0.0);
        logger.debug("创建 LinearExpression: {}", this);
    }

    public static LinearExpression of(Map<Variable, Double> terms, double offset) {
        return new LinearExpression(terms, offset);
    }

    public static LinearExpression of(Map<Variable, Double> terms) {
        return new LinearExpression(terms, 0.0);
    }

    public static LinearExpression constant(double offset) {
        return new LinearExpression(Collections.emptyMap(), offset);
    }

    public double getCoefficient(Variable variable) {
        return terms.getOrDefault(variable, 0.0);
    }

    @Override
    protected void flattenOnceAndAddTo(double scale, ProcessedElements processed,
                                       ToProcessElements<? super LinearBase> queue) {
        processed.addOffset(scale * offset);
        for (Map.Entry<Variable, Double> entry : terms.entrySet()) {
            processed.addTerm(entry.getKey(), scale * entry.getValue());
        }
    }

    /**
     * 根据给定的变量赋值计算表达式的值。
     * @throws IllegalArgumentException 赋值中缺少某个变量。
     */
    public double evaluate(VariableValuation valuation) {
        double result = offset;
        for (Map.Entry<Variable, Double> entry : terms.entrySet()) {
            result += entry.getValue() * valuation.getValue(entry.getKey());
        }
        logger.debug("根据赋值 {} 计算了 {} 的结果为 {}", valuation, this, result);
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
        LinearExpression that = (LinearExpression) o;
        return offset == that.offset && terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(offset);
        for (Map.Entry<Variable, Double> entry : terms.entrySet()) {
            double coefficient = entry.getValue();
            sb.append(coefficient < 0 ? " - " : " + ")
                    .append(Math.abs(coefficient))
                    .append(" * ")
                    .append(entry.getKey());
        }
        return sb.toString();
    }
}
