package org.mathopt.elemental;

import java.util.List;

/**
 * 以单个元素为键的布尔属性，默认值均为 false。
 */
public enum BoolAttr1 implements Attribute<Boolean> {
    VAR_INTEGER(ElementType.VARIABLE),
    AUX_OBJ_MAXIMIZE(ElementType.AUXILIARY_OBJECTIVE),
    IND_CON_ACTIVATE_ON_ZERO(ElementType.INDICATOR_CONSTRAINT);

    private final List<ElementType> keyTypes;

    BoolAttr1(ElementType keyType) {
        this.keyTypes = List.of(keyType);
    }

    @Override
    public List<ElementType> getKeyTypes() {
        return keyTypes;
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
