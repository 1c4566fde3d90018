package org.mathopt.elemental;

import java.util.List;

/**
 * 以 (二次约束, 变量, 变量) 为键的二次系数，后两个位置无序。
 */
public enum SymmetricDoubleAttr3 implements Attribute<Double> {
    QUAD_CON_QUAD_COEF;

    @Override
    public List<ElementType> getKeyTypes() {
        return List.of(ElementType.QUADRATIC_CONSTRAINT, ElementType.VARIABLE, ElementType.VARIABLE);
    }

    @Override
    public Symmetry getSymmetry() {
        return Symmetry.LAST_PAIR;
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
