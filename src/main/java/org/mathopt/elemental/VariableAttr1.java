package org.mathopt.elemental;

import java.util.List;
import java.util.Optional;

/**
 * 值为变量 id 的属性。{@link #UNSET} 表示未设置。
 * 被引用的变量删除后，引用它的条目会被重置为未设置。
 */
public enum VariableAttr1 implements Attribute<Long> {
    IND_CON_INDICATOR(ElementType.INDICATOR_CONSTRAINT);

    public static final long UNSET = -1L;

    private final List<ElementType> keyTypes;

    VariableAttr1(ElementType keyType) {
        this.keyTypes = List.of(keyType);
    }

    @Override
    public List<ElementType> getKeyTypes() {
        return keyTypes;
    }

    @Override
    public Long getDefaultValue() {
        return UNSET;
    }

    @Override
    public Class<Long> getValueType() {
        return Long.class;
    }

    @Override
    public Optional<ElementType> getValueElementType() {
        return Optional.of(ElementType.VARIABLE);
    }
}
