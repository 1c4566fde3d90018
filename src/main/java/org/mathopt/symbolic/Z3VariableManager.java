package org.mathopt.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Optimize;
import com.microsoft.z3.RealSort;
import lombok.Getter;
import org.mathopt.elemental.AttrKey;
import org.mathopt.elemental.BoolAttr1;
import org.mathopt.elemental.DoubleAttr1;
import org.mathopt.elemental.ElementType;
import org.mathopt.elemental.ModelSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 负责把快照中的变量 id 映射为 Z3 实数项，并提供构造线性/二次项和区间约束的工具。
 * 整数变量用整数常量表示，再转换为实数参与运算。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;

    private final Map<Long, ArithExpr<RealSort>> variableZ3Vars;

    /**
     * @param ctx      Z3 Context 实例。
     * @param snapshot 模型快照，其中所有变量都会被预先创建。
     */
    public Z3VariableManager(Context ctx, ModelSnapshot snapshot) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        Objects.requireNonNull(snapshot, "ModelSnapshot cannot be null.");
        Map<Long, ArithExpr<RealSort>> vars = new HashMap<>();
        for (long id : snapshot.getElements(ElementType.VARIABLE).keySet()) {
            boolean integer = snapshot.getAttrValue(BoolAttr1.VAR_INTEGER, AttrKey.of(id));
            String name = "x" + id;
            vars.put(id, integer ? ctx.mkInt2Real(ctx.mkIntConst(name)) : ctx.mkRealConst(name));
            logger.debug("创建 Z3 变量: {} (integer={})", name, integer);
        }
        this.variableZ3Vars = Collections.unmodifiableMap(vars);
        logger.debug("Z3VariableManager 初始化完成，管理 {} 个变量。", variableZ3Vars.size());
    }

    /**
     * 获取指定变量 id 对应的 Z3 项。
     * @throws IllegalArgumentException 快照中没有该变量。
     */
    public ArithExpr<RealSort> getZ3Var(long variableId) {
        ArithExpr<RealSort> var = variableZ3Vars.get(variableId);
        if (var == null) {
            logger.error("快照中不存在变量 {}", variableId);
            throw new IllegalArgumentException("Unknown variable id " + variableId);
        }
        return var;
    }

    /**
     * 浮点数按其精确的十进制展开转换为 Z3 有理数。
     */
    public ArithExpr<RealSort> mkNumeral(double value) {
        if (!Double.isFinite(value)) {
            logger.error("无法把非有限值 {} 转换为 Z3 数值", value);
            throw new IllegalArgumentException("Cannot convert non-finite value " + value + " to a Z3 numeral");
        }
        return ctx.mkReal(new BigDecimal(value).toPlainString());
    }

    public ArithExpr<RealSort> mkLinear(Map<Long, Double> coefficients, double offset) {
        List<ArithExpr<RealSort>> terms = new ArrayList<>();
        terms.add(mkNumeral(offset));
        coefficients.forEach((id, coefficient) -> terms.add(ctx.mkMul(mkNumeral(coefficient), getZ3Var(id))));
        return mkSum(terms);
    }

    /**
     * @param quadraticCoefficients 键为 (第一个变量 id, 第二个变量 id)。
     */
    public ArithExpr<RealSort> mkQuadratic(Map<AttrKey, Double> quadraticCoefficients,
                                           Map<Long, Double> linearCoefficients, double offset) {
        List<ArithExpr<RealSort>> terms = new ArrayList<>();
        terms.add(mkLinear(linearCoefficients, offset));
        quadraticCoefficients.forEach((key, coefficient) -> terms.add(
                ctx.mkMul(mkNumeral(coefficient), getZ3Var(key.get(0)), getZ3Var(key.get(1)))));
        return mkSum(terms);
    }

    /**
     * {@code lb <= expr <= ub}，无穷的一侧省略；两侧相等时生成等式。
     */
    public BoolExpr mkRange(ArithExpr<RealSort> expr, double lowerBound, double upperBound) {
        if (lowerBound == upperBound && Double.isFinite(lowerBound)) {
            return ctx.mkEq(expr, mkNumeral(lowerBound));
        }
        List<BoolExpr> parts = new ArrayList<>();
        if (lowerBound != Double.NEGATIVE_INFINITY) {
            parts.add(ctx.mkGe(expr, mkNumeral(lowerBound)));
        }
        if (upperBound != Double.POSITIVE_INFINITY) {
            parts.add(ctx.mkLe(expr, mkNumeral(upperBound)));
        }
        if (parts.isEmpty()) {
            return ctx.mkTrue();
        }
        return parts.size() == 1 ? parts.get(0) : ctx.mkAnd(parts.toArray(new BoolExpr[0]));
    }

    /**
     * 向优化器断言所有变量的上下界。
     */
    public void assertVariableBounds(Optimize optimize, ModelSnapshot snapshot) {
        for (Map.Entry<Long, ArithExpr<RealSort>> entry : variableZ3Vars.entrySet()) {
            double lb = snapshot.getAttrValue(DoubleAttr1.VAR_LB, AttrKey.of(entry.getKey()));
            double ub = snapshot.getAttrValue(DoubleAttr1.VAR_UB, AttrKey.of(entry.getKey()));
            optimize.Add(mkRange(entry.getValue(), lb, ub));
            logger.debug("断言 Z3 约束: {} <= x{} <= {}", lb, entry.getKey(), ub);
        }
    }

    private ArithExpr<RealSort> mkSum(List<ArithExpr<RealSort>> terms) {
        ArithExpr<RealSort> sum = terms.get(0);
        for (int i = 1; i < terms.size(); i++) {
            sum = ctx.mkAdd(sum, terms.get(i));
        }
        return sum;
    }
}
