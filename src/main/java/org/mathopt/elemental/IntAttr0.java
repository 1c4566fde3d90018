package org.mathopt.elemental;

import java.util.List;

/**
 * 无键的整数属性。
 */
public enum IntAttr0 implements Attribute<Long> {
    /** 主目标在多目标求解中的优先级。 */
    OBJ_PRIORITY;

    @Override
    public List<ElementType> getKeyTypes() {
        return List.of();
    }

    @Override
    public Long getDefaultValue() {
        return 0L;
    }

    @Override
    public Class<Long> getValueType() {
        return Long.class;
    }
}
