package org.mathopt.core;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Triple;
import org.mathopt.elemental.AttrKey;
import org.mathopt.elemental.BoolAttr1;
import org.mathopt.elemental.DoubleAttr1;
import org.mathopt.elemental.DoubleAttr2;
import org.mathopt.elemental.ElementType;
import org.mathopt.elemental.Elemental;
import org.mathopt.elemental.IntAttr1;
import org.mathopt.elemental.ModelSnapshot;
import org.mathopt.elemental.SymmetricDoubleAttr3;
import org.mathopt.elemental.VariableAttr1;
import org.mathopt.exceptions.TypeMismatchException;
import org.mathopt.exceptions.UnknownElementException;
import org.mathopt.expressions.ExpressionNode;
import org.mathopt.expressions.Flattener;
import org.mathopt.expressions.LinearBase;
import org.mathopt.expressions.LinearExpression;
import org.mathopt.expressions.QuadraticTermKey;
import org.mathopt.expressions.bounded.BoundedTypes;
import org.mathopt.expressions.bounded.InequalityNormalizer;
import org.mathopt.expressions.bounded.NormalizedLinearInequality;
import org.mathopt.expressions.bounded.NormalizedQuadraticInequality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 优化模型。所有数据都保存在底层的 {@link Elemental} 中，
 * 本类负责把表达式规范化后写入存储，并返回各元素的句柄。
 * <p>
 * 添加约束时有两种写法：传入一个有界表达式 (例如 {@code x.plus(y).le(3)})，
 * 或分别传入 lb、ub、expr。同时使用两种写法会抛出
 * {@link org.mathopt.exceptions.AmbiguousConstructionException}。
 * @author Ayalyt
 */
public final class Model {

    private static final Logger logger = LoggerFactory.getLogger(Model.class);

    @Getter
    private final Elemental elemental;

    private final PrimaryObjective objective;

    public Model(String name) {
        this(name, "");
    }

    /**
     * @param primaryObjectiveName 主目标的名称，null 视为空串。
     */
    public Model(String name, String primaryObjectiveName) {
        this(new Elemental(name == null ? "" : name, primaryObjectiveName == null ? "" : primaryObjectiveName));
    }

    public Model() {
        this("");
    }

    private Model(Elemental elemental) {
        this.elemental = elemental;
        this.objective = new PrimaryObjective(elemental);
        logger.info("创建模型: '{}'", elemental.getModelName());
    }

    public static Model fromSnapshot(ModelSnapshot snapshot) {
        return new Model(Elemental.fromSnapshot(snapshot));
    }

    /**
     * 复制模型数据，不复制更新跟踪器。
     */
    public Model copy(String name) {
        return new Model(elemental.copy(name));
    }

    public String getName() {
        return elemental.getModelName();
    }

    // --- 变量 ---

    public Variable addVariable(double lowerBound, double upperBound, boolean isInteger, String name) {
        long id = elemental.addElement(ElementType.VARIABLE, name);
        Variable variable = new Variable(elemental, id);
        variable.setLowerBound(lowerBound);
        variable.setUpperBound(upperBound);
        variable.setInteger(isInteger);
        logger.debug("添加变量 {}: [{}, {}], integer={}", variable, lowerBound, upperBound, isInteger);
        return variable;
    }

    public Variable addVariable(String name) {
        return addVariable(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, false, name);
    }

    public Variable addBinaryVariable(String name) {
        return addVariable(0.0, 1.0, true, name);
    }

    public Variable addIntegerVariable(double lowerBound, double upperBound, String name) {
        return addVariable(lowerBound, upperBound, true, name);
    }

    /**
     * 删除变量以及它在所有约束和目标中的系数。
     * @throws UnknownElementException 变量已被删除。
     */
    public void deleteVariable(Variable variable) {
        checkVariable(elemental, variable);
        deleteElement(ElementType.VARIABLE, variable.getId());
    }

    public Variable getVariable(long id) {
        checkExists(ElementType.VARIABLE, id);
        return new Variable(elemental, id);
    }

    public boolean hasVariable(long id) {
        return elemental.elementExists(ElementType.VARIABLE, id);
    }

    public int numVariables() {
        return elemental.numElements(ElementType.VARIABLE);
    }

    public List<Variable> variables() {
        List<Variable> variables = new ArrayList<>();
        for (long id : elemental.allElements(ElementType.VARIABLE)) {
            variables.add(new Variable(elemental, id));
        }
        return variables;
    }

    // --- 线性约束 ---

    public LinearConstraint addLinearConstraint(BoundedTypes<? extends LinearBase> bounded) {
        return addLinearConstraint(bounded, null, null, null, "");
    }

    public LinearConstraint addLinearConstraint(BoundedTypes<? extends LinearBase> bounded, String name) {
        return addLinearConstraint(bounded, null, null, null, name);
    }

    /**
     * @param bounded 有界表达式，与 lb/ub/expr 互斥，可为 null。
     * @param lb      下界，缺省为 -∞。
     * @param ub      上界，缺省为 +∞。
     * @param expr    表达式，缺省为 0。
     */
    public LinearConstraint addLinearConstraint(BoundedTypes<? extends LinearBase> bounded,
                                                Double lb, Double ub, LinearBase expr, String name) {
        NormalizedLinearInequality inequality = InequalityNormalizer.normalizeLinear(bounded, lb, ub, expr);
        inequality.getCoefficients().keySet().forEach(variable -> checkVariableExists(elemental, variable));
        long id = elemental.addElement(ElementType.LINEAR_CONSTRAINT, name);
        elemental.setAttr(DoubleAttr1.LIN_CON_LB, AttrKey.of(id), inequality.getLowerBound());
        elemental.setAttr(DoubleAttr1.LIN_CON_UB, AttrKey.of(id), inequality.getUpperBound());
        List<AttrKey> keys = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (Map.Entry<Variable, Double> term : inequality.getCoefficients().entrySet()) {
            keys.add(AttrKey.of(id, term.getKey().getId()));
            values.add(term.getValue());
        }
        elemental.setAttrs(DoubleAttr2.LIN_CON_COEF, keys, values);
        LinearConstraint constraint = new LinearConstraint(elemental, id);
        logger.debug("添加线性约束 {}: {}", constraint, inequality);
        return constraint;
    }

    public void deleteLinearConstraint(LinearConstraint constraint) {
        checkHandle(constraint.getElemental());
        deleteElement(ElementType.LINEAR_CONSTRAINT, constraint.getId());
    }

    public LinearConstraint getLinearConstraint(long id) {
        checkExists(ElementType.LINEAR_CONSTRAINT, id);
        return new LinearConstraint(elemental, id);
    }

    public int numLinearConstraints() {
        return elemental.numElements(ElementType.LINEAR_CONSTRAINT);
    }

    public List<LinearConstraint> linearConstraints() {
        List<LinearConstraint> constraints = new ArrayList<>();
        for (long id : elemental.allElements(ElementType.LINEAR_CONSTRAINT)) {
            constraints.add(new LinearConstraint(elemental, id));
        }
        return constraints;
    }

    /**
     * @return 约束中系数非零的变量，按 id 升序。
     */
    public List<Variable> rowNonzeros(LinearConstraint constraint) {
        checkHandle(constraint.getElemental());
        List<Variable> variables = new ArrayList<>();
        for (AttrKey key : elemental.slice(DoubleAttr2.LIN_CON_COEF, 0, constraint.getId())) {
            variables.add(new Variable(elemental, key.get(1)));
        }
        return variables;
    }

    /**
     * @return 变量系数非零的线性约束，按 id 升序。
     */
    public List<LinearConstraint> columnNonzeros(Variable variable) {
        checkVariable(elemental, variable);
        List<LinearConstraint> constraints = new ArrayList<>();
        for (AttrKey key : elemental.slice(DoubleAttr2.LIN_CON_COEF, 1, variable.getId())) {
            constraints.add(new LinearConstraint(elemental, key.get(0)));
        }
        return constraints;
    }

    /**
     * @return 线性约束矩阵的所有非零元素 (约束, 变量, 系数)，按 (约束 id, 变量 id) 升序。
     */
    public List<Triple<LinearConstraint, Variable, Double>> linearConstraintMatrixEntries() {
        List<Triple<LinearConstraint, Variable, Double>> entries = new ArrayList<>();
        for (AttrKey key : elemental.attrNonDefaults(DoubleAttr2.LIN_CON_COEF)) {
            entries.add(Triple.of(new LinearConstraint(elemental, key.get(0)),
                    new Variable(elemental, key.get(1)),
                    elemental.getAttr(DoubleAttr2.LIN_CON_COEF, key)));
        }
        return entries;
    }

    // --- 二次约束 ---

    public QuadraticConstraint addQuadraticConstraint(BoundedTypes<? extends ExpressionNode> bounded, String name) {
        return addQuadraticConstraint(bounded, null, null, null, name);
    }

    public QuadraticConstraint addQuadraticConstraint(BoundedTypes<? extends ExpressionNode> bounded,
                                                      Double lb, Double ub, ExpressionNode expr, String name) {
        NormalizedQuadraticInequality inequality = InequalityNormalizer.normalizeQuadratic(bounded, lb, ub, expr);
        inequality.getLinearCoefficients().keySet().forEach(variable -> checkVariableExists(elemental, variable));
        inequality.getQuadraticCoefficients().keySet().forEach(key -> {
            checkVariableExists(elemental, key.getFirst());
            checkVariableExists(elemental, key.getSecond());
        });
        long id = elemental.addElement(ElementType.QUADRATIC_CONSTRAINT, name);
        elemental.setAttr(DoubleAttr1.QUAD_CON_LB, AttrKey.of(id), inequality.getLowerBound());
        elemental.setAttr(DoubleAttr1.QUAD_CON_UB, AttrKey.of(id), inequality.getUpperBound());
        for (Map.Entry<Variable, Double> term : inequality.getLinearCoefficients().entrySet()) {
            elemental.setAttr(DoubleAttr2.QUAD_CON_LIN_COEF, AttrKey.of(id, term.getKey().getId()), term.getValue());
        }
        for (Map.Entry<QuadraticTermKey, Double> term : inequality.getQuadraticCoefficients().entrySet()) {
            elemental.setAttr(SymmetricDoubleAttr3.QUAD_CON_QUAD_COEF,
                    AttrKey.of(id, term.getKey().getFirst().getId(), term.getKey().getSecond().getId()),
                    term.getValue());
        }
        QuadraticConstraint constraint = new QuadraticConstraint(elemental, id);
        logger.debug("添加二次约束 {}: {}", constraint, inequality);
        return constraint;
    }

    public void deleteQuadraticConstraint(QuadraticConstraint constraint) {
        checkHandle(constraint.getElemental());
        deleteElement(ElementType.QUADRATIC_CONSTRAINT, constraint.getId());
    }

    public QuadraticConstraint getQuadraticConstraint(long id) {
        checkExists(ElementType.QUADRATIC_CONSTRAINT, id);
        return new QuadraticConstraint(elemental, id);
    }

    public int numQuadraticConstraints() {
        return elemental.numElements(ElementType.QUADRATIC_CONSTRAINT);
    }

    public List<QuadraticConstraint> quadraticConstraints() {
        List<QuadraticConstraint> constraints = new ArrayList<>();
        for (long id : elemental.allElements(ElementType.QUADRATIC_CONSTRAINT)) {
            constraints.add(new QuadraticConstraint(elemental, id));
        }
        return constraints;
    }

    // --- 指示约束 ---

    public IndicatorConstraint addIndicatorConstraint(Variable indicator, boolean activateOnZero,
                                                      BoundedTypes<? extends LinearBase> impliedConstraint,
                                                      String name) {
        return addIndicatorConstraint(indicator, activateOnZero, impliedConstraint, null, null, null, name);
    }

    /**
     * @param indicator 指示变量，可为 null (未设置)。
     */
    public IndicatorConstraint addIndicatorConstraint(Variable indicator, boolean activateOnZero,
                                                      BoundedTypes<? extends LinearBase> impliedConstraint,
                                                      Double lb, Double ub, LinearBase expr, String name) {
        if (indicator != null) {
            checkVariableExists(elemental, indicator);
        }
        NormalizedLinearInequality inequality = InequalityNormalizer.normalizeLinear(impliedConstraint, lb, ub, expr);
        inequality.getCoefficients().keySet().forEach(variable -> checkVariableExists(elemental, variable));
        long id = elemental.addElement(ElementType.INDICATOR_CONSTRAINT, name);
        if (indicator != null) {
            elemental.setAttr(VariableAttr1.IND_CON_INDICATOR, AttrKey.of(id), indicator.getId());
        }
        elemental.setAttr(BoolAttr1.IND_CON_ACTIVATE_ON_ZERO, AttrKey.of(id), activateOnZero);
        elemental.setAttr(DoubleAttr1.IND_CON_LB, AttrKey.of(id), inequality.getLowerBound());
        elemental.setAttr(DoubleAttr1.IND_CON_UB, AttrKey.of(id), inequality.getUpperBound());
        for (Map.Entry<Variable, Double> term : inequality.getCoefficients().entrySet()) {
            elemental.setAttr(DoubleAttr2.IND_CON_LIN_COEF, AttrKey.of(id, term.getKey().getId()), term.getValue());
        }
        IndicatorConstraint constraint = new IndicatorConstraint(elemental, id);
        logger.debug("添加指示约束 {}: indicator={}, {}", constraint, indicator, inequality);
        return constraint;
    }

    public void deleteIndicatorConstraint(IndicatorConstraint constraint) {
        checkHandle(constraint.getElemental());
        deleteElement(ElementType.INDICATOR_CONSTRAINT, constraint.getId());
    }

    public IndicatorConstraint getIndicatorConstraint(long id) {
        checkExists(ElementType.INDICATOR_CONSTRAINT, id);
        return new IndicatorConstraint(elemental, id);
    }

    public int numIndicatorConstraints() {
        return elemental.numElements(ElementType.INDICATOR_CONSTRAINT);
    }

    public List<IndicatorConstraint> indicatorConstraints() {
        List<IndicatorConstraint> constraints = new ArrayList<>();
        for (long id : elemental.allElements(ElementType.INDICATOR_CONSTRAINT)) {
            constraints.add(new IndicatorConstraint(elemental, id));
        }
        return constraints;
    }

    // --- 目标 ---

    public PrimaryObjective getObjective() {
        return objective;
    }

    public void setObjective(ExpressionNode expression, boolean maximize) {
        objective.setToExpression(expression);
        objective.setMaximize(maximize);
    }

    public void maximize(ExpressionNode expression) {
        setObjective(expression, true);
    }

    public void minimize(ExpressionNode expression) {
        setObjective(expression, false);
    }

    public AuxiliaryObjective addAuxiliaryObjective(long priority, LinearBase expression, boolean maximize, String name) {
        LinearExpression flat = expression == null
                ? LinearExpression.constant(0.0)
                : Flattener.asFlatLinearExpression(expression);
        flat.getTerms().keySet().forEach(variable -> checkVariableExists(elemental, variable));
        long id = elemental.addElement(ElementType.AUXILIARY_OBJECTIVE, name);
        AuxiliaryObjective auxiliary = new AuxiliaryObjective(elemental, id);
        auxiliary.setToExpression(flat);
        elemental.setAttr(IntAttr1.AUX_OBJ_PRIORITY, AttrKey.of(id), priority);
        auxiliary.setMaximize(maximize);
        logger.debug("添加辅助目标 {}，优先级 {}", auxiliary, priority);
        return auxiliary;
    }

    public void deleteAuxiliaryObjective(AuxiliaryObjective auxiliary) {
        checkHandle(auxiliary.getElemental());
        deleteElement(ElementType.AUXILIARY_OBJECTIVE, auxiliary.getId());
    }

    public AuxiliaryObjective getAuxiliaryObjective(long id) {
        checkExists(ElementType.AUXILIARY_OBJECTIVE, id);
        return new AuxiliaryObjective(elemental, id);
    }

    public int numAuxiliaryObjectives() {
        return elemental.numElements(ElementType.AUXILIARY_OBJECTIVE);
    }

    public List<AuxiliaryObjective> auxiliaryObjectives() {
        List<AuxiliaryObjective> objectives = new ArrayList<>();
        for (long id : elemental.allElements(ElementType.AUXILIARY_OBJECTIVE)) {
            objectives.add(new AuxiliaryObjective(elemental, id));
        }
        return objectives;
    }

    // --- 导出与跟踪 ---

    public ModelSnapshot exportModel(boolean removeNames) {
        return elemental.exportModel(removeNames);
    }

    public ModelSnapshot exportModel() {
        return exportModel(false);
    }

    public UpdateTracker addUpdateTracker() {
        UpdateTracker tracker = new UpdateTracker(elemental, elemental.addDiff());
        logger.info("模型 '{}' 添加更新跟踪器 {}", getName(), tracker.getDiffHandle());
        return tracker;
    }

    /**
     * 移除跟踪器，此后再使用它会抛出 {@link org.mathopt.exceptions.UsedAfterRemovalException}。
     */
    public void removeUpdateTracker(UpdateTracker tracker) {
        Objects.requireNonNull(tracker, "Model-removeUpdateTracker: tracker 不能为 null");
        checkHandle(tracker.getElemental());
        elemental.deleteDiff(tracker.getDiffHandle());
    }

    /**
     * @throws TypeMismatchException 变量属于另一个模型。
     */
    public void checkCompatible(Variable variable) {
        checkVariable(elemental, variable);
    }

    // --- 内部 ---

    private void deleteElement(ElementType type, long id) {
        if (!elemental.deleteElement(type, id)) {
            logger.error("删除不存在的元素 {} {}", type, id);
            throw new UnknownElementException(type, id, type + " with id " + id + " was not in the model");
        }
    }

    private void checkExists(ElementType type, long id) {
        if (!elemental.elementExists(type, id)) {
            logger.error("模型 '{}' 中不存在元素 {} {}", getName(), type, id);
            throw new UnknownElementException(type, id);
        }
    }

    private void checkHandle(Elemental owner) {
        if (owner != elemental) {
            logger.error("句柄不属于模型 '{}'", getName());
            throw new TypeMismatchException("Handle belongs to another model");
        }
    }

    static void checkVariable(Elemental elemental, Variable variable) {
        if (variable == null) {
            throw new TypeMismatchException("Expected a variable, got null");
        }
        if (variable.getElemental() != elemental) {
            logger.error("变量 {} 属于另一个模型", variable);
            throw new TypeMismatchException("Variable " + variable + " belongs to another model");
        }
    }

    static void checkVariableExists(Elemental elemental, Variable variable) {
        checkVariable(elemental, variable);
        if (!elemental.elementExists(ElementType.VARIABLE, variable.getId())) {
            logger.error("变量 {} 已被删除", variable.getId());
            throw new UnknownElementException(ElementType.VARIABLE, variable.getId());
        }
    }

    @Override
    public String toString() {
        return "Model{'" + getName() + "', variables=" + numVariables()
                + ", linearConstraints=" + numLinearConstraints() + "}";
    }
}
