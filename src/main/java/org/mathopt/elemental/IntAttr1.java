package org.mathopt.elemental;

import java.util.List;

/**
 * 以单个元素为键的整数属性。
 */
public enum IntAttr1 implements Attribute<Long> {
    AUX_OBJ_PRIORITY(ElementType.AUXILIARY_OBJECTIVE);

    private final List<ElementType> keyTypes;

    IntAttr1(ElementType keyType) {
        this.keyTypes = List.of(keyType);
    }

    @Override
    public List<ElementType> getKeyTypes() {
        return keyTypes;
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
