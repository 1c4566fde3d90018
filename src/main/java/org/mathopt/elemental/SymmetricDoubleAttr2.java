package org.mathopt.elemental;

import java.util.List;

/**
 * 以无序变量对为键的二次系数。(x, y) 与 (y, x) 是同一个键。
 */
public enum SymmetricDoubleAttr2 implements Attribute<Double> {
    OBJ_QUAD_COEF;

    @Override
    public List<ElementType> getKeyTypes() {
        return List.of(ElementType.VARIABLE, ElementType.VARIABLE);
    }

    @Override
    public Symmetry getSymmetry() {
        return Symmetry.FIRST_PAIR;
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
