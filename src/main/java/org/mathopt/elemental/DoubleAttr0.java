package org.mathopt.elemental;

import java.util.List;

/**
 * 无键的浮点属性。
 */
public enum DoubleAttr0 implements Attribute<Double> {
    /** 主目标的常数项。 */
    OBJ_OFFSET;

    @Override
    public List<ElementType> getKeyTypes() {
        return List.of();
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
