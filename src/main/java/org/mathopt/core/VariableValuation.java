package org.mathopt.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 变量到取值的映射，用于对表达式求值。此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class VariableValuation {

    private static final Logger logger = LoggerFactory.getLogger(VariableValuation.class);

    private final SortedMap<Variable, Double> values;

    private VariableValuation(Map<Variable, Double> values) {
        this.values = Collections.unmodifiableSortedMap(new TreeMap<>(
                Objects.requireNonNull(values, "VariableValuation: values 不能为 null")));
        logger.debug("创建 VariableValuation: {}", this);
    }

    public static VariableValuation of(Map<Variable, Double> values) {
        return new VariableValuation(values);
    }

    /**
     * @throws IllegalArgumentException 赋值中没有该变量。
     */
    public double getValue(Variable variable) {
        Double value = values.get(variable);
        if (value == null) {
            logger.error("尝试获取不存在的变量值：变量 '{}' 不存在于当前赋值 {} 中。", variable, this);
            throw new IllegalArgumentException("Variable '" + variable + "' has no value in this valuation");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VariableValuation that = (VariableValuation) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
