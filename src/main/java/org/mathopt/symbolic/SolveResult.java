package org.mathopt.symbolic;

import lombok.Getter;
import org.mathopt.core.Model;
import org.mathopt.core.Variable;
import org.mathopt.core.VariableValuation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 一次求解的结果。只有 {@link TerminationReason#OPTIMAL} 时才带有目标值和变量取值。
 * @author Ayalyt
 */
@Getter
public final class SolveResult {

    private static final Logger logger = LoggerFactory.getLogger(SolveResult.class);

    private final TerminationReason terminationReason;

    /**
     * 目标值，没有解时为 NaN。
     */
    private final double objectiveValue;

    private final SortedMap<Long, Double> variableValues;

    private SolveResult(TerminationReason terminationReason, double objectiveValue, Map<Long, Double> variableValues) {
        this.terminationReason = Objects.requireNonNull(terminationReason, "SolveResult: terminationReason 不能为 null");
        this.objectiveValue = objectiveValue;
        this.variableValues = Collections.unmodifiableSortedMap(new TreeMap<>(variableValues));
    }

    public static SolveResult optimal(double objectiveValue, Map<Long, Double> variableValues) {
        return new SolveResult(TerminationReason.OPTIMAL, objectiveValue, variableValues);
    }

    public static SolveResult noSolution(TerminationReason terminationReason) {
        return new SolveResult(terminationReason, Double.NaN, Collections.emptyMap());
    }

    public boolean hasSolution() {
        return terminationReason == TerminationReason.OPTIMAL;
    }

    /**
     * @throws IllegalArgumentException 结果中没有该变量的取值。
     */
    public double getVariableValue(Variable variable) {
        Double value = variableValues.get(variable.getId());
        if (value == null) {
            logger.error("结果中没有变量 {} 的取值，终止原因为 {}", variable, terminationReason);
            throw new IllegalArgumentException("No value for variable " + variable + " in this result");
        }
        return value;
    }

    /**
     * 把按 id 记录的取值转换为模型中变量的赋值。
     */
    public VariableValuation toValuation(Model model) {
        Map<Variable, Double> values = new HashMap<>();
        variableValues.forEach((id, value) -> values.put(model.getVariable(id), value));
        return VariableValuation.of(values);
    }

    @Override
    public String toString() {
        return "SolveResult{" + terminationReason + ", objective=" + objectiveValue + ", values=" + variableValues + "}";
    }
}
