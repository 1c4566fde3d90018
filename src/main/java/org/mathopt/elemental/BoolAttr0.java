package org.mathopt.elemental;

import java.util.List;

/**
 * 无键的布尔属性。
 */
public enum BoolAttr0 implements Attribute<Boolean> {
    /** 主目标是否为最大化。 */
    MAXIMIZE;

    @Override
    public List<ElementType> getKeyTypes() {
        return List.of();
    }

    @Override
    public Boolean getDefaultValue() {
        return Boolean.FALSE;
    }

    @Override
    public Class<Boolean> getValueType() {
        return Boolean.class;
    }
}
