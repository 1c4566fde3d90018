package org.mathopt.expressions.bounded;

import lombok.Getter;
import org.mathopt.core.Variable;
import org.mathopt.expressions.QuadraticTermKey;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 规范化后的二次不等式，常数项已移入两侧界。此类是不可变的。
 */
@Getter
public final class NormalizedQuadraticInequality {

    private final double lowerBound;

    private final double upperBound;

    private final SortedMap<Variable, Double> linearCoefficients;

    private final SortedMap<QuadraticTermKey, Double> quadraticCoefficients;

    private NormalizedQuadraticInequality(double lowerBound, double upperBound,
                                          Map<Variable, Double> linearCoefficients,
                                          Map<QuadraticTermKey, Double> quadraticCoefficients) {
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.linearCoefficients = Collections.unmodifiableSortedMap(new TreeMap<>(
                Objects.requireNonNull(linearCoefficients, "NormalizedQuadraticInequality: linearCoefficients 不能为 null")));
        this.quadraticCoefficients = Collections.unmodifiableSortedMap(new TreeMap<>(
                Objects.requireNonNull(quadraticCoefficients, "NormalizedQuadraticInequality: quadraticCoefficients 不能为 null")));
    }

    public static NormalizedQuadraticInequality of(double lowerBound, double upperBound,
                                                   Map<Variable, Double> linearCoefficients,
                                                   Map<QuadraticTermKey, Double> quadraticCoefficients) {
        return new NormalizedQuadraticInequality(lowerBound, upperBound, linearCoefficients, quadraticCoefficients);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NormalizedQuadraticInequality that = (NormalizedQuadraticInequality) o;
        return lowerBound == that.lowerBound
                && upperBound == that.upperBound
                && linearCoefficients.equals(that.linearCoefficients)
                && quadraticCoefficients.equals(that.quadraticCoefficients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowerBound + 0.0, upperBound + 0.0, linearCoefficients, quadraticCoefficients);
    }

    @Override
    public String toString() {
        return lowerBound + " <= " + linearCoefficients + " + " + quadraticCoefficients + " <= " + upperBound;
    }
}
