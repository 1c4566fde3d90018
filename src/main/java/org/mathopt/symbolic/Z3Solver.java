package org.mathopt.symbolic;

import com.microsoft.z3.AlgebraicNum;
import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Optimize;
import com.microsoft.z3.Params;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.RealSort;
import com.microsoft.z3.Status;
import org.mathopt.elemental.AttrKey;
import org.mathopt.elemental.BoolAttr0;
import org.mathopt.elemental.BoolAttr1;
import org.mathopt.elemental.DoubleAttr0;
import org.mathopt.elemental.DoubleAttr1;
import org.mathopt.elemental.DoubleAttr2;
import org.mathopt.elemental.ElementType;
import org.mathopt.elemental.ModelSnapshot;
import org.mathopt.elemental.SymmetricDoubleAttr2;
import org.mathopt.elemental.SymmetricDoubleAttr3;
import org.mathopt.elemental.VariableAttr1;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 把模型快照交给 Z3 的 Optimize 求解。Z3 只作为黑盒使用。
 * <p>
 * 转换的内容：变量 (整数性和上下界)、线性约束、二次约束、指示约束和主目标。
 * 辅助目标不会传给 Z3。未设置指示变量的指示约束被忽略。
 * @author Ayalyt
 */
public class Z3Solver implements Solver {

    private static final Logger logger = LoggerFactory.getLogger(Z3Solver.class);

    @Override
    public SolveResult solve(ModelSnapshot model, SolveParameters parameters) {
        logger.info("Z3 开始求解模型 '{}'", model.getName());
        try (Context ctx = new Context()) {
            Optimize optimize = ctx.mkOptimize();
            if (parameters.getTimeLimit() != null) {
                Params params = ctx.mkParams();
                params.add("timeout", (int) Math.min(Integer.MAX_VALUE, parameters.getTimeLimit().toMillis()));
                optimize.setParameters(params);
            }
            Z3VariableManager varManager = new Z3VariableManager(ctx, model);
            varManager.assertVariableBounds(optimize, model);
            assertLinearConstraints(optimize, varManager, model);
            assertQuadraticConstraints(optimize, varManager, model);
            assertIndicatorConstraints(optimize, ctx, varManager, model);

            ArithExpr<RealSort> objective = varManager.mkQuadratic(
                    model.getAttribute(SymmetricDoubleAttr2.OBJ_QUAD_COEF),
                    byFirstId(model.getAttribute(DoubleAttr1.OBJ_LIN_COEF)),
                    model.getAttrValue(DoubleAttr0.OBJ_OFFSET, AttrKey.EMPTY));
            boolean maximize = model.getAttrValue(BoolAttr0.MAXIMIZE, AttrKey.EMPTY);
            Optimize.Handle<RealSort> handle = maximize ? optimize.MkMaximize(objective) : optimize.MkMinimize(objective);
            if (parameters.isEnableOutput()) {
                logger.info("Z3 问题:\n{}", optimize);
            }

            Status status = optimize.Check();
            logger.info("Z3 求解状态: {}", status);
            return switch (status) {
                case UNSATISFIABLE -> SolveResult.noSolution(TerminationReason.INFEASIBLE);
                case UNKNOWN -> {
                    logger.warn("Z3 未能得出结论: {}", optimize.getReasonUnknown());
                    yield SolveResult.noSolution(TerminationReason.NO_SOLUTION_FOUND);
                }
                case SATISFIABLE -> extractResult(optimize, handle, varManager);
            };
        }
    }

    private SolveResult extractResult(Optimize optimize, Optimize.Handle<RealSort> handle, Z3VariableManager varManager) {
        Expr<RealSort> objectiveValue = handle.getValue();
        if (!isNumeral(objectiveValue)) {
            logger.info("目标值不是有限数 ({})，判定为无界", objectiveValue);
            return SolveResult.noSolution(TerminationReason.UNBOUNDED);
        }
        com.microsoft.z3.Model z3Model = optimize.getModel();
        Map<Long, Double> values = new HashMap<>();
        for (Map.Entry<Long, ArithExpr<RealSort>> entry : varManager.getVariableZ3Vars().entrySet()) {
            values.put(entry.getKey(), toDouble(z3Model.eval(entry.getValue(), true)));
        }
        double objective = toDouble(objectiveValue);
        logger.info("Z3 找到最优解，目标值 {}", objective);
        return SolveResult.optimal(objective, values);
    }

    private void assertLinearConstraints(Optimize optimize, Z3VariableManager varManager, ModelSnapshot model) {
        Map<Long, Map<Long, Double>> rows = byRow(model.getAttribute(DoubleAttr2.LIN_CON_COEF));
        for (long id : model.getElements(ElementType.LINEAR_CONSTRAINT).keySet()) {
            ArithExpr<RealSort> expr = varManager.mkLinear(rows.getOrDefault(id, Map.of()), 0.0);
            optimize.Add(varManager.mkRange(expr,
                    model.getAttrValue(DoubleAttr1.LIN_CON_LB, AttrKey.of(id)),
                    model.getAttrValue(DoubleAttr1.LIN_CON_UB, AttrKey.of(id))));
        }
    }

    private void assertQuadraticConstraints(Optimize optimize, Z3VariableManager varManager, ModelSnapshot model) {
        Map<Long, Map<Long, Double>> linearRows = byRow(model.getAttribute(DoubleAttr2.QUAD_CON_LIN_COEF));
        Map<Long, Map<AttrKey, Double>> quadraticRows = new HashMap<>();
        model.getAttribute(SymmetricDoubleAttr3.QUAD_CON_QUAD_COEF).forEach((key, value) ->
                quadraticRows.computeIfAbsent(key.get(0), k -> new TreeMap<>()).put(AttrKey.of(key.get(1), key.get(2)), value));
        for (long id : model.getElements(ElementType.QUADRATIC_CONSTRAINT).keySet()) {
            ArithExpr<RealSort> expr = varManager.mkQuadratic(quadraticRows.getOrDefault(id, Map.of()),
                    linearRows.getOrDefault(id, Map.of()), 0.0);
            optimize.Add(varManager.mkRange(expr,
                    model.getAttrValue(DoubleAttr1.QUAD_CON_LB, AttrKey.of(id)),
                    model.getAttrValue(DoubleAttr1.QUAD_CON_UB, AttrKey.of(id))));
        }
    }

    private void assertIndicatorConstraints(Optimize optimize, Context ctx, Z3VariableManager varManager,
                                            ModelSnapshot model) {
        Map<Long, Map<Long, Double>> rows = byRow(model.getAttribute(DoubleAttr2.IND_CON_LIN_COEF));
        for (long id : model.getElements(ElementType.INDICATOR_CONSTRAINT).keySet()) {
            long indicator = model.getAttrValue(VariableAttr1.IND_CON_INDICATOR, AttrKey.of(id));
            if (indicator == VariableAttr1.UNSET) {
                logger.debug("指示约束 {} 没有指示变量，忽略", id);
                continue;
            }
            boolean activateOnZero = model.getAttrValue(BoolAttr1.IND_CON_ACTIVATE_ON_ZERO, AttrKey.of(id));
            BoolExpr active = ctx.mkEq(varManager.getZ3Var(indicator), varManager.mkNumeral(activateOnZero ? 0.0 : 1.0));
            ArithExpr<RealSort> expr = varManager.mkLinear(rows.getOrDefault(id, Map.of()), 0.0);
            optimize.Add(ctx.mkImplies(active, varManager.mkRange(expr,
                    model.getAttrValue(DoubleAttr1.IND_CON_LB, AttrKey.of(id)),
                    model.getAttrValue(DoubleAttr1.IND_CON_UB, AttrKey.of(id)))));
        }
    }

    private static Map<Long, Map<Long, Double>> byRow(SortedMap<AttrKey, Double> coefficients) {
        Map<Long, Map<Long, Double>> rows = new HashMap<>();
        coefficients.forEach((key, value) ->
                rows.computeIfAbsent(key.get(0), k -> new TreeMap<>()).put(key.get(1), value));
        return rows;
    }

    private static Map<Long, Double> byFirstId(SortedMap<AttrKey, Double> coefficients) {
        Map<Long, Double> result = new TreeMap<>();
        coefficients.forEach((key, value) -> result.put(key.get(0), value));
        return result;
    }

    private static boolean isNumeral(Expr<?> expr) {
        return expr.isIntNum() || expr.isRatNum() || expr.isAlgebraicNumber();
    }

    private static double toDouble(Expr<?> value) {
        if (value instanceof IntNum intNum) {
            return intNum.getBigInteger().doubleValue();
        }
        if (value instanceof RatNum ratNum) {
            BigDecimal numerator = new BigDecimal(ratNum.getNumerator().getBigInteger());
            BigDecimal denominator = new BigDecimal(ratNum.getDenominator().getBigInteger());
            return numerator.divide(denominator, MathContext.DECIMAL64).doubleValue();
        }
        if (value instanceof AlgebraicNum algebraicNum) {
            String decimal = algebraicNum.toDecimal(17);
            return Double.parseDouble(decimal.endsWith("?") ? decimal.substring(0, decimal.length() - 1) : decimal);
        }
        logger.error("无法把 Z3 值 {} 转换为浮点数", value);
        throw new IllegalStateException("Cannot convert Z3 value " + value + " to a double");
    }
}
