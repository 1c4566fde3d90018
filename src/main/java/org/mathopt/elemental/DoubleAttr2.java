package org.mathopt.elemental;

import java.util.List;

/**
 * 以 (约束或目标, 变量) 为键的线性系数。
 */
public enum DoubleAttr2 implements Attribute<Double> {
    LIN_CON_COEF(ElementType.LINEAR_CONSTRAINT),
    AUX_OBJ_LIN_COEF(ElementType.AUXILIARY_OBJECTIVE),
    QUAD_CON_LIN_COEF(ElementType.QUADRATIC_CONSTRAINT),
    IND_CON_LIN_COEF(ElementType.INDICATOR_CONSTRAINT);

    private final List<ElementType> keyTypes;

    DoubleAttr2(ElementType rowType) {
        this.keyTypes = List.of(rowType, ElementType.VARIABLE);
    }

    @Override
    public List<ElementType> getKeyTypes() {
        return keyTypes;
    }

    @Override
    public Double getDefaultValue() {
        return 0.0;
    }

    @Override
    public Class<Double> getValueType() {
        return Double.class;
    }
}
