package org.mathopt.expressions.bounded;

import lombok.Getter;
import org.mathopt.core.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 规范化后的线性不等式 {@code lowerBound <= Σ c_i x_i <= upperBound}，常数项已移入两侧界。
 * 此类是不可变的。
 */
@Getter
public final class NormalizedLinearInequality {

    private static final Logger logger = LoggerFactory.getLogger(NormalizedLinearInequality.class);

    private final double lowerBound;

    private final double upperBound;

    private final SortedMap<Variable, Double> coefficients;

    private NormalizedLinearInequality(double lowerBound, double upperBound, Map<Variable, Double> coefficients) {
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.coefficients = Collections.unmodifiableSortedMap(new TreeMap<>(
                Objects.requireNonNull(coefficients, "NormalizedLinearInequality: coefficients 不能为 null")));
        if (this.coefficients.isEmpty()) {
            if (lowerBound > 0.0 || upperBound < 0.0) {
                logger.warn("创建了一个恒假约束: {}", this);
            } else {
                logger.info("创建了一个不含变量的约束: {}", this);
            }
        }
        logger.debug("创建 NormalizedLinearInequality: {}", this);
    }

    public static NormalizedLinearInequality of(double lowerBound, double upperBound, Map<Variable, Double> coefficients) {
        return new NormalizedLinearInequality(lowerBound, upperBound, coefficients);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NormalizedLinearInequality that = (NormalizedLinearInequality) o;
        return lowerBound == that.lowerBound
                && upperBound == that.upperBound
                && coefficients.equals(that.coefficients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowerBound + 0.0, upperBound + 0.0, coefficients);
    }

    @Override
    public String toString() {
        return lowerBound + " <= " + coefficients + " <= " + upperBound;
    }
}
