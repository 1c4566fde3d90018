package org.mathopt.elemental;

import java.util.List;

/**
 * 以单个元素为键的浮点属性。下界默认 -∞，上界默认 +∞，其余默认 0。
 */
public enum DoubleAttr1 implements Attribute<Double> {
    VAR_LB(ElementType.VARIABLE, Double.NEGATIVE_INFINITY),
    VAR_UB(ElementType.VARIABLE, Double.POSITIVE_INFINITY),
    OBJ_LIN_COEF(ElementType.VARIABLE, 0.0),
    LIN_CON_LB(ElementType.LINEAR_CONSTRAINT, Double.NEGATIVE_INFINITY),
    LIN_CON_UB(ElementType.LINEAR_CONSTRAINT, Double.POSITIVE_INFINITY),
    AUX_OBJ_OFFSET(ElementType.AUXILIARY_OBJECTIVE, 0.0),
    QUAD_CON_LB(ElementType.QUADRATIC_CONSTRAINT, Double.NEGATIVE_INFINITY),
    QUAD_CON_UB(ElementType.QUADRATIC_CONSTRAINT, Double.POSITIVE_INFINITY),
    IND_CON_LB(ElementType.INDICATOR_CONSTRAINT, Double.NEGATIVE_INFINITY),
    IND_CON_UB(ElementType.INDICATOR_CONSTRAINT, Double.POSITIVE_INFINITY);

    private final List<ElementType> keyTypes;
    private final Double defaultValue;

    DoubleAttr1(ElementType keyType, double defaultValue) {
        this.keyTypes = List.of(keyType);
        this.defaultValue = defaultValue;
    }

    @Override
    public List<ElementType> getKeyTypes() {
        return keyTypes;
    }

    @Override
    public Double getDefaultValue() {
        return defaultValue;
    }

    @Override
    public Class<Double> getValueType() {
        return Double.class;
    }
}
